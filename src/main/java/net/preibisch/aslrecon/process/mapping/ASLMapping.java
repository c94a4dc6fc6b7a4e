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
package net.preibisch.aslrecon.process.mapping;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import net.preibisch.aslrecon.Threads;
import net.preibisch.aslrecon.process.acquisition.ASLData;
import net.preibisch.aslrecon.process.acquisition.MRIParameters;
import net.preibisch.aslrecon.process.fitting.FitSettings;
import net.preibisch.aslrecon.process.fitting.FitStatistics;
import net.preibisch.aslrecon.process.fitting.LevenbergMarquardtFitter;
import net.preibisch.aslrecon.process.fitting.VoxelFitResult;
import net.preibisch.aslrecon.process.fitting.VoxelFitScheduler;
import net.preibisch.aslrecon.process.fitting.VoxelProblem;
import net.preibisch.aslrecon.process.mask.MaskGate;
import net.preibisch.aslrecon.process.smoothing.MapSmoothing;

/**
 * Common state of all mappings: the acquisition, a private copy of the MRI constants and the
 * brain mask. Until a mask is set every voxel is processed.
 */
public abstract class ASLMapping
{
	private static final Logger LOG = LoggerFactory.getLogger( ASLMapping.class );

	// voxels that are not fitted
	public static final double FALLBACK = 0.0;

	protected final ASLData aslData;
	protected final MRIParameters constants = new MRIParameters();

	protected RandomAccessibleInterval< IntType > brainMask;
	protected FitStatistics lastStatistics;

	protected ASLMapping( final ASLData aslData )
	{
		if ( aslData == null )
			throw new IllegalArgumentException( "ASLData must be provided." );

		this.aslData = aslData;
	}

	/**
	 * Uses all voxels labeled 1.
	 */
	public void setBrainMask( final RandomAccessibleInterval< ? extends RealType< ? > > mask )
	{
		setBrainMask( mask, 1 );
	}

	/**
	 * @param mask - label image with the (x, y, z) dimensions of the acquisition
	 * @param label - voxels with this value are fitted, all others are not
	 */
	public void setBrainMask( final RandomAccessibleInterval< ? extends RealType< ? > > mask, final int label )
	{
		this.brainMask = MaskGate.gate( mask, label, spatialInterval() );

		LOG.info( "Brain mask set, label {} selects {} voxels", label, MaskGate.countForeground( brainMask ) );
	}

	/**
	 * @return the gated mask (label or 0), all ones if no mask was set
	 */
	public RandomAccessibleInterval< IntType > getBrainMask()
	{
		if ( brainMask == null )
			brainMask = MaskGate.all( spatialInterval() );

		return brainMask;
	}

	public double getConstant( final String name ) { return constants.getConstant( name ); }
	public void setConstant( final double value, final String name ) { constants.setConstant( value, name ); }

	/**
	 * @return the constants of this mapping, changes affect the next run
	 */
	public MRIParameters getConstants() { return constants; }

	/**
	 * @return counters of the last fit run, null before the first one
	 */
	public FitStatistics getLastStatistics() { return lastStatistics; }

	protected Interval spatialInterval()
	{
		final Interval interval = aslData.getSpatialInterval();

		if ( interval == null )
			throw new IllegalArgumentException( "ASLData has neither an M0 nor a pcasl image." );

		return interval;
	}

	protected VoxelFitResult fit(
			final VoxelProblem problem,
			final FitSettings settings,
			final MappingParameters params,
			final String jobDescription )
	{
		final VoxelFitScheduler scheduler = new VoxelFitScheduler(
				getBrainMask(),
				problem,
				settings,
				params.fitter == null ? new LevenbergMarquardtFitter() : params.fitter,
				FALLBACK,
				params.numWorkers,
				params.progress == null ? new VoxelFitScheduler.LoggingProgress( jobDescription ) : params.progress,
				jobDescription );

		final VoxelFitResult result = scheduler.run();
		lastStatistics = result.statistics();

		return result;
	}

	protected static FitSettings settings( final double[] par0, final double[] lb, final double[] ub, final MappingParameters params )
	{
		return new FitSettings( par0, lb, ub, params.maxIterations, params.maxEvaluations );
	}

	/**
	 * Worker count and smoothing settings are checked before any work is dispatched.
	 */
	protected static void validate( final MappingParameters params )
	{
		if ( params == null )
			throw new IllegalArgumentException( "Mapping parameters must be provided." );

		Threads.validateWorkerCount( params.numWorkers );
		MapSmoothing.validate( params.smoothing, params.smoothingParams );
	}

	protected static Map< String, RandomAccessibleInterval< DoubleType > > smooth(
			final Map< String, RandomAccessibleInterval< DoubleType > > maps,
			final MappingParameters params )
	{
		return MapSmoothing.apply( maps, params.smoothing, params.smoothingParams );
	}

	/**
	 * @return a new zero-min image of the values times factor
	 */
	protected static ArrayImg< DoubleType, DoubleArray > scaled( final RandomAccessibleInterval< ? extends RealType< ? > > map, final double factor )
	{
		final ArrayImg< DoubleType, DoubleArray > out = ArrayImgs.doubles( dimensions( map ) );
		final Cursor< ? extends RealType< ? > > in = Views.flatIterable( map ).cursor();

		for ( final DoubleType t : out )
			t.set( in.next().getRealDouble() * factor );

		return out;
	}

	protected static long[] dimensions( final Interval interval )
	{
		final long[] dim = new long[ interval.numDimensions() ];
		interval.dimensions( dim );
		return dim;
	}
}
