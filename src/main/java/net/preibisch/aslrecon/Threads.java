/*-
 * #%L
 * Software for the voxel-wise reconstruction of Arterial Spin Labeling
 * (ASL) perfusion MRI parameter maps.
 * %%
 * Copyright (C) 2024 ASL Reconstruction developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.aslrecon;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public class Threads
{
	/**
	 * @return num threads for the worker pool, all processors the JVM can use
	 */
	public static int numThreads() { return Runtime.getRuntime().availableProcessors(); }

	public static ExecutorService createFixedExecutorService( final int nThreads ) { return Executors.newFixedThreadPool( nThreads ); }
	public static ExecutorService createFixedExecutorService() { return createFixedExecutorService( numThreads() ); }

	/**
	 * A worker count is valid if it lies in [1, available processors].
	 *
	 * @param numWorkers - the requested number of workers
	 * @return the same number
	 * @throws IllegalArgumentException if the count is out of range
	 */
	public static int validateWorkerCount( final int numWorkers )
	{
		if ( numWorkers < 1 || numWorkers > numThreads() )
			throw new IllegalArgumentException( "Number of proecess must be at least 1 and less than maximum cores availble." );

		return numWorkers;
	}

	/**
	 * Same as {@link #validateWorkerCount(int)} for counts that arrive as a generic number
	 * (e.g. from a parameter map), non-integral values are rejected.
	 *
	 * @param numWorkers - the requested number of workers
	 * @return the count as int
	 */
	public static int validateWorkerCount( final Number numWorkers )
	{
		if ( numWorkers == null || numWorkers.doubleValue() != Math.rint( numWorkers.doubleValue() ) )
			throw new IllegalArgumentException( "Number of proecess must be at least 1 and less than maximum cores availble." );

		return validateWorkerCount( numWorkers.intValue() );
	}

	/**
	 * Runs all tasks and blocks until every one of them finished.
	 *
	 * @param tasks - the tasks
	 * @param taskExecutor - the service to run them on
	 * @param jobDescription - used in error messages
	 * @return the results in task order
	 * @throws IllegalStateException if a task threw or the calling thread was interrupted
	 */
	public static < T > List< T > execTasks( final List< ? extends Callable< T > > tasks, final ExecutorService taskExecutor, final String jobDescription )
	{
		final ArrayList< T > results = new ArrayList<>( tasks.size() );

		try
		{
			// invokeAll() returns when all tasks are complete
			for ( final Future< T > future : taskExecutor.invokeAll( tasks ) )
				results.add( future.get() );
		}
		catch ( final InterruptedException e )
		{
			Thread.currentThread().interrupt();
			throw new IllegalStateException( "Interrupted while waiting to " + jobDescription, e );
		}
		catch ( final ExecutionException e )
		{
			throw new IllegalStateException( "Failed to " + jobDescription + ": " + e.getCause(), e.getCause() );
		}

		return results;
	}
}
