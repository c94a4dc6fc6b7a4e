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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import org.junit.Test;

public class ThreadsTest
{
	@Test
	public void testResultsInTaskOrder()
	{
		final List< Callable< Integer > > tasks = new ArrayList<>();
		for ( int i = 0; i < 20; ++i )
		{
			final int j = i;
			tasks.add( () -> j * j );
		}

		final ExecutorService service = Threads.createFixedExecutorService( Math.min( 3, Threads.numThreads() ) );

		try
		{
			final List< Integer > results = Threads.execTasks( tasks, service, "squares" );

			for ( int i = 0; i < 20; ++i )
				assertEquals( i * i, results.get( i ).intValue() );
		}
		finally
		{
			service.shutdown();
		}
	}

	@Test
	public void testWorkerCounts()
	{
		assertEquals( 1, Threads.validateWorkerCount( 1 ) );
		assertEquals( Threads.numThreads(), Threads.validateWorkerCount( (Number)Double.valueOf( Threads.numThreads() ) ) );

		for ( final Number n : new Number[] { 0, -3, 1.5, Threads.numThreads() + 1, null } )
		{
			try
			{
				Threads.validateWorkerCount( n );
				fail( "accepted " + n );
			}
			catch ( final IllegalArgumentException e )
			{
				assertEquals( "Number of proecess must be at least 1 and less than maximum cores availble.", e.getMessage() );
			}
		}
	}

	@Test( expected = IllegalStateException.class )
	public void testFailingTask()
	{
		final List< Callable< Integer > > tasks = new ArrayList<>();
		tasks.add( () -> { throw new IllegalArgumentException( "bad" ); } );

		final ExecutorService service = Threads.createFixedExecutorService( 1 );

		try
		{
			Threads.execTasks( tasks, service, "failing" );
		}
		finally
		{
			service.shutdown();
		}
	}
}
