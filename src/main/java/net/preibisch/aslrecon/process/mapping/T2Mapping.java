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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import net.preibisch.aslrecon.process.acquisition.ASLData;
import net.preibisch.aslrecon.process.acquisition.AcquisitionDescriptor;
import net.preibisch.aslrecon.process.fitting.VoxelData;
import net.preibisch.aslrecon.process.fitting.VoxelFitResult;
import net.preibisch.aslrecon.process.fitting.VoxelProblem;
import net.preibisch.aslrecon.process.fitting.VoxelSampler;
import net.preibisch.aslrecon.process.models.MonoExponentialModel;

/**
 * Fits a mono-exponential T2 decay over the echo times, separately for every post-labeling
 * delay.
 * <p>
 * Produces "t2", an (x, y, z, pld) stack in ms, and "mean_t2", a 1D image with the mean of
 * each T2 volume (NaN ignored, unfitted voxels count as 0).
 */
public class T2Mapping extends ASLMapping
{
	private static final Logger LOG = LoggerFactory.getLogger( T2Mapping.class );

	public static final String T2 = "t2";
	public static final String MEAN_T2 = "mean_t2";

	private ArrayImg< DoubleType, DoubleArray > t2Maps;
	private double[] meanT2s;

	public T2Mapping( final ASLData aslData )
	{
		super( aslData );

		final AcquisitionDescriptor descriptor = aslData.getDescriptor();

		if ( !descriptor.hasTe() || descriptor.numEchoes() == 0 || descriptor.numDelays() == 0 )
			throw new IllegalArgumentException( "ASLData must provide TE and PLD values." );

		if ( descriptor.hasDw() )
			throw new IllegalArgumentException( "ASLData must not include DW values." );

		if ( !aslData.isMultiEcho() )
			throw new IllegalArgumentException( "T2Mapping needs a 5D (x,y,z,pld,te) pcasl image." );
	}

	/**
	 * @return the (x, y, z, pld) T2 stack of the last run, null before the first one
	 */
	public RandomAccessibleInterval< DoubleType > getT2Maps() { return t2Maps; }

	/**
	 * @return one mean T2 per delay, null before the first run
	 */
	public double[] getMeanT2s() { return meanT2s == null ? null : meanT2s.clone(); }

	public Map< String, RandomAccessibleInterval< DoubleType > > createMap()
	{
		return createMap( new T2MappingParameters() );
	}

	/**
	 * @return "t2" and "mean_t2"
	 */
	public Map< String, RandomAccessibleInterval< DoubleType > > createMap( final T2MappingParameters params )
	{
		validate( params );

		final AcquisitionDescriptor descriptor = aslData.getDescriptor();
		final double[] pld = descriptor.getPld();
		final double[] te = descriptor.getTe();

		final RandomAccessibleInterval< ? extends RealType< ? > > pcasl = Views.zeroMin( aslData.getPcasl() );

		if ( pcasl.dimension( ASLData.PLD_DIM ) != pld.length || pcasl.dimension( ASLData.TE_DIM ) != te.length )
			throw new IllegalArgumentException(
					"pcasl has " + pcasl.dimension( ASLData.PLD_DIM ) + " delays and " + pcasl.dimension( ASLData.TE_DIM ) +
					" echoes, but " + pld.length + " PLD and " + te.length + " TE values are given." );

		LOG.info( "Starting T2 map creation" );

		final long[] spatial = ASLData.spatialDimensions( pcasl );
		final int numVoxels = (int)( spatial[ 0 ] * spatial[ 1 ] * spatial[ 2 ] );

		final double[] stack = new double[ numVoxels * pld.length ];
		final double[] means = new double[ pld.length ];

		for ( int p = 0; p < pld.length; ++p )
		{
			final VoxelFitResult result = fit(
					new T2Problem( Views.hyperSlice( pcasl, ASLData.PLD_DIM, p ), te, params.noiseFloor, params.initialT2 ),
					settings( new double[] { params.noiseFloor, params.initialT2 }, params.lb, params.ub, params ),
					params,
					"T2 fit (PLD " + pld[ p ] + " ms)" );

			final double[] t2 = result.buffer( 1 );
			System.arraycopy( t2, 0, stack, p * numVoxels, numVoxels );
			means[ p ] = nanMean( t2 );
		}

		t2Maps = ArrayImgs.doubles( stack, spatial[ 0 ], spatial[ 1 ], spatial[ 2 ], pld.length );
		meanT2s = means;

		LOG.info( "T2 mapping completed successfully, mean T2 per PLD: {}", Arrays.toString( means ) );

		final Map< String, RandomAccessibleInterval< DoubleType > > maps = new LinkedHashMap<>();
		maps.put( T2, t2Maps );
		maps.put( MEAN_T2, ArrayImgs.doubles( means.clone(), means.length ) );

		return smooth( maps, params );
	}

	static double nanMean( final double[] values )
	{
		double sum = 0;
		long count = 0;

		for ( final double v : values )
			if ( !Double.isNaN( v ) )
			{
				sum += v;
				++count;
			}

		return count == 0 ? Double.NaN : sum / count;
	}

	/**
	 * Fits (s0, t2) of one delay, the initial s0 is the maximum of the voxel.
	 */
	static class T2Problem implements VoxelProblem
	{
		final RandomAccessibleInterval< ? extends RealType< ? > > pcasl;
		final double[] te;
		final double noiseFloor, initialT2;

		/**
		 * @param pcasl - (x, y, z, te) volume of one delay
		 */
		T2Problem(
				final RandomAccessibleInterval< ? extends RealType< ? > > pcasl,
				final double[] te,
				final double noiseFloor,
				final double initialT2 )
		{
			this.pcasl = pcasl;
			this.te = te;
			this.noiseFloor = noiseFloor;
			this.initialT2 = initialT2;
		}

		@Override
		public int numParameters() { return 2; }

		@Override
		public VoxelSampler createSampler()
		{
			final RandomAccess< ? extends RealType< ? > > access = pcasl.randomAccess();
			final int teDim = ASLData.TE_DIM - 1;

			return ( x, y, z ) ->
			{
				access.setPosition( x, 0 );
				access.setPosition( y, 1 );
				access.setPosition( z, 2 );

				final double[] signal = new double[ te.length ];
				double max = -Double.MAX_VALUE;

				for ( int e = 0; e < te.length; ++e )
				{
					access.setPosition( e, teDim );
					signal[ e ] = access.get().getRealDouble();

					if ( Double.isNaN( signal[ e ] ) || Double.isInfinite( signal[ e ] ) )
						return null;

					max = Math.max( max, signal[ e ] );
				}

				if ( max < noiseFloor )
					return null;

				return new VoxelData( signal, params -> MonoExponentialModel.predict( te, params[ 0 ], params[ 1 ] ), new double[] { max, initialT2 } );
			};
		}

		@Override
		public boolean accept( final double[] fitted )
		{
			return fitted[ 1 ] > 0 && !Double.isNaN( fitted[ 1 ] ) && !Double.isInfinite( fitted[ 1 ] );
		}
	}
}
