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

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;

/**
 * Fits all voxels of one x-plane. Everything it needs is handed over at construction, it
 * writes only the buffer indices of its own plane.
 */
public class VoxelFitWorker implements Callable< Void >
{
	private static final Logger LOG = LoggerFactory.getLogger( VoxelFitWorker.class );

	final long x;
	final RandomAccessibleInterval< ? extends RealType< ? > > mask;
	final VoxelProblem problem;
	final FitSettings settings;
	final LeastSquaresFitter fitter;
	final double[][] buffers;
	final FitStatistics statistics;
	final AtomicInteger completed;
	final int totalChunks;
	final ProgressListener progress;

	/**
	 * @param x - the plane to process
	 * @param mask - zero-min (x, y, z) mask, voxels with value 0 are skipped
	 * @param problem - the problem to solve at each voxel
	 * @param settings - shared initial guess, bounds and budget
	 * @param fitter - the solver
	 * @param buffers - one flat output buffer per parameter, pre-filled with the fallback
	 * @param statistics - shared counters
	 * @param completed - shared counter of finished planes
	 * @param totalChunks - number of planes of the run
	 * @param progress - notified when this plane is done
	 */
	public VoxelFitWorker(
			final long x,
			final RandomAccessibleInterval< ? extends RealType< ? > > mask,
			final VoxelProblem problem,
			final FitSettings settings,
			final LeastSquaresFitter fitter,
			final double[][] buffers,
			final FitStatistics statistics,
			final AtomicInteger completed,
			final int totalChunks,
			final ProgressListener progress )
	{
		this.x = x;
		this.mask = mask;
		this.problem = problem;
		this.settings = settings;
		this.fitter = fitter;
		this.buffers = buffers;
		this.statistics = statistics;
		this.completed = completed;
		this.totalChunks = totalChunks;
		this.progress = progress;
	}

	@Override
	public Void call()
	{
		final long sx = mask.dimension( 0 );
		final long sy = mask.dimension( 1 );
		final long sz = mask.dimension( 2 );

		final RandomAccess< ? extends RealType< ? > > maskAccess = mask.randomAccess();
		final VoxelSampler sampler = problem.createSampler();
		final long[] position = new long[] { x, 0, 0 };

		for ( long y = 0; y < sy; ++y )
			for ( long z = 0; z < sz; ++z )
			{
				position[ 1 ] = y;
				position[ 2 ] = z;
				maskAccess.setPosition( position );

				if ( maskAccess.get().getRealDouble() == 0 )
					continue;

				statistics.masked.increment();

				final int index = (int)( z * ( sy * sx ) + y * sx + x );
				fitVoxel( sampler, x, y, z, index );
			}

		progress.advance( completed.incrementAndGet(), totalChunks );

		return null;
	}

	protected void fitVoxel( final VoxelSampler sampler, final long x, final long y, final long z, final int index )
	{
		final VoxelData data = sampler.sample( x, y, z );

		if ( data == null )
		{
			statistics.rejected.increment();
			return;
		}

		final double[] initialGuess = data.initialGuess() == null ? settings.initialGuess() : data.initialGuess();

		try
		{
			final double[] fitted = fitter.fit( data.model(), data.observed(), initialGuess, settings );

			if ( !problem.accept( fitted ) )
			{
				statistics.rejected.increment();
				return;
			}

			for ( int p = 0; p < buffers.length; ++p )
				buffers[ p ][ index ] = fitted[ p ];

			statistics.converged.increment();
		}
		catch ( final FitNotConvergedException e )
		{
			// the fallback is already in place
			statistics.failed.increment();
			LOG.trace( "Fit did not converge at ({}, {}, {}): {}", x, y, z, e.getMessage() );
		}
	}
}
