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
package net.preibisch.aslrecon.process.fitting;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import net.preibisch.aslrecon.Threads;

/**
 * Fits a {@link VoxelProblem} at every non-zero voxel of a 3D mask.
 * <p>
 * The volume is split along x, one task per x-plane, and the tasks run on a fixed pool of
 * workers created for this run only. Every voxel owns one index of the flat output buffers,
 * so workers never write the same memory and no locking is needed. Voxels outside the mask,
 * voxels refused by the problem and voxels whose fit does not converge keep the fallback value.
 * <p>
 * A scheduler runs exactly once: CONFIGURED, RUNNING, COMPLETE. There is no cancellation,
 * {@link #run()} returns when every plane is done.
 */
public class VoxelFitScheduler
{
	private static final Logger LOG = LoggerFactory.getLogger( VoxelFitScheduler.class );

	public enum State { CONFIGURED, RUNNING, COMPLETE };

	final RandomAccessibleInterval< ? extends RealType< ? > > mask;
	final VoxelProblem problem;
	final FitSettings settings;
	final LeastSquaresFitter fitter;
	final double fallback;
	final int numWorkers;
	final ProgressListener progress;
	final String jobDescription;

	private final AtomicReference< State > state = new AtomicReference<>( State.CONFIGURED );

	/**
	 * All configuration is validated here, before anything is dispatched.
	 *
	 * @param mask - (x, y, z) mask, only non-zero voxels are fitted
	 * @param problem - the per-voxel problem
	 * @param settings - initial guess, bounds and budget, must match problem.numParameters()
	 * @param fitter - the solver, shared by all workers
	 * @param fallback - value of every voxel that is not fitted
	 * @param numWorkers - pool size, in [1, available processors]
	 * @param progress - notified once per finished x-plane
	 * @param jobDescription - used for logging
	 */
	public VoxelFitScheduler(
			final RandomAccessibleInterval< ? extends RealType< ? > > mask,
			final VoxelProblem problem,
			final FitSettings settings,
			final LeastSquaresFitter fitter,
			final double fallback,
			final int numWorkers,
			final ProgressListener progress,
			final String jobDescription )
	{
		if ( mask == null || mask.numDimensions() != 3 )
			throw new IllegalArgumentException( "The mask must be a 3D volume." );

		if ( problem == null || settings == null || fitter == null )
			throw new IllegalArgumentException( "Problem, settings and fitter must be provided." );

		if ( settings.numParameters() != problem.numParameters() )
			throw new IllegalArgumentException(
					"The model has " + problem.numParameters() + " free parameters, but the initial guess and bounds have " + settings.numParameters() + "." );

		if ( Intervals.numElements( mask ) > Integer.MAX_VALUE )
			throw new IllegalArgumentException( "Volume too large for flat buffers: " + Arrays.toString( Intervals.dimensionsAsLongArray( mask ) ) );

		this.mask = Views.zeroMin( mask );
		this.problem = problem;
		this.settings = settings;
		this.fitter = fitter;
		this.fallback = fallback;
		this.numWorkers = Threads.validateWorkerCount( numWorkers );
		this.progress = progress == null ? ProgressListener.none() : progress;
		this.jobDescription = jobDescription;
	}

	public VoxelFitScheduler(
			final RandomAccessibleInterval< ? extends RealType< ? > > mask,
			final VoxelProblem problem,
			final FitSettings settings,
			final double fallback,
			final int numWorkers,
			final String jobDescription )
	{
		this( mask, problem, settings, new LevenbergMarquardtFitter(), fallback, numWorkers, new LoggingProgress( jobDescription ), jobDescription );
	}

	public State getState() { return state.get(); }

	/**
	 * Fits all masked voxels, blocks until done.
	 *
	 * @return the parameter buffers and statistics
	 * @throws IllegalStateException if this scheduler already ran, or a worker failed unexpectedly
	 */
	public VoxelFitResult run()
	{
		if ( !state.compareAndSet( State.CONFIGURED, State.RUNNING ) )
			throw new IllegalStateException( "A VoxelFitScheduler can only run once, state is " + state.get() );

		final long[] dimensions = Intervals.dimensionsAsLongArray( mask );
		final int numVoxels = (int)Intervals.numElements( mask );
		final int numPlanes = (int)dimensions[ 0 ];

		final double[][] buffers = new double[ problem.numParameters() ][ numVoxels ];
		for ( final double[] buffer : buffers )
			Arrays.fill( buffer, fallback );

		final FitStatistics statistics = new FitStatistics();
		final AtomicInteger completed = new AtomicInteger( 0 );

		final ArrayList< VoxelFitWorker > tasks = new ArrayList<>( numPlanes );
		for ( long x = 0; x < numPlanes; ++x )
			tasks.add( new VoxelFitWorker( x, mask, problem, settings, fitter, buffers, statistics, completed, numPlanes, progress ) );

		LOG.info( "{}: fitting {} voxels ({} planes) with {} workers, {}",
				jobDescription, numVoxels, numPlanes, numWorkers, settings );

		final long time = System.currentTimeMillis();
		final ExecutorService service = Threads.createFixedExecutorService( numWorkers );

		try
		{
			Threads.execTasks( tasks, service, jobDescription );
		}
		finally
		{
			service.shutdown();
		}

		state.set( State.COMPLETE );

		LOG.info( "{}: done in {} ms, {}", jobDescription, System.currentTimeMillis() - time, statistics );

		return new VoxelFitResult( dimensions, buffers, statistics );
	}

	/**
	 * Logs progress in steps of 10% at debug level.
	 */
	public static class LoggingProgress implements ProgressListener
	{
		final String jobDescription;
		final AtomicInteger lastDecile = new AtomicInteger( 0 );

		public LoggingProgress( final String jobDescription )
		{
			this.jobDescription = jobDescription;
		}

		@Override
		public void advance( final int completedChunks, final int totalChunks )
		{
			final int decile = ( completedChunks * 10 ) / totalChunks;
			final int last = lastDecile.get();

			if ( decile > last && lastDecile.compareAndSet( last, decile ) )
				LOG.debug( "{}: {}%", jobDescription, decile * 10 );
		}
	}
}
