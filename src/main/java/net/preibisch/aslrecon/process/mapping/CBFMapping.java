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

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import net.preibisch.aslrecon.process.acquisition.ASLData;
import net.preibisch.aslrecon.process.acquisition.AcquisitionDescriptor;
import net.preibisch.aslrecon.process.fitting.VoxelData;
import net.preibisch.aslrecon.process.fitting.VoxelFitResult;
import net.preibisch.aslrecon.process.fitting.VoxelProblem;
import net.preibisch.aslrecon.process.fitting.VoxelSampler;
import net.preibisch.aslrecon.process.models.BuxtonModel;

/**
 * Fits cerebral blood flow (CBF) and arterial transit time (ATT) per voxel with the Buxton
 * model. For multi-echo data the first echo is used.
 * <p>
 * Produces "cbf" (ml/g/ms), "cbf_norm" (ml/100g/min) and "att" (ms). Voxels outside the mask
 * and voxels whose fit does not converge are 0.
 */
public class CBFMapping extends ASLMapping
{
	private static final Logger LOG = LoggerFactory.getLogger( CBFMapping.class );

	public static final String CBF = "cbf";
	public static final String CBF_NORM = "cbf_norm";
	public static final String ATT = "att";

	// scale of the normalized map
	public static final double CBF_NORM_FACTOR = 60.0 * 60.0 * 1000.0;

	private RandomAccessibleInterval< DoubleType > cbfMap, attMap;

	public CBFMapping( final ASLData aslData )
	{
		super( aslData );

		if ( aslData.getPcasl() == null || aslData.getM0() == null )
			throw new IllegalArgumentException( "ASLData is incomplete. CBFMapping need pcasl and m0 images." );
	}

	/**
	 * @return the last cbf map (unsmoothed), null before the first run
	 */
	public RandomAccessibleInterval< DoubleType > getCbfMap() { return cbfMap; }

	/**
	 * @return the last att map (unsmoothed), null before the first run
	 */
	public RandomAccessibleInterval< DoubleType > getAttMap() { return attMap; }

	public Map< String, RandomAccessibleInterval< DoubleType > > createMap()
	{
		return createMap( new CBFMappingParameters() );
	}

	/**
	 * Fits all voxels of the brain mask. The stored maps are unsmoothed, the returned ones
	 * are smoothed if requested.
	 *
	 * @return "cbf", "cbf_norm" and "att", (x, y, z) each
	 */
	public Map< String, RandomAccessibleInterval< DoubleType > > createMap( final CBFMappingParameters params )
	{
		return smooth( computeMaps( params ), params );
	}

	Map< String, RandomAccessibleInterval< DoubleType > > computeMaps( final CBFMappingParameters params )
	{
		validate( params );

		final AcquisitionDescriptor descriptor = aslData.getDescriptor();
		final double[] ld = descriptor.getLd();
		final double[] pld = descriptor.getPld();

		if ( ld.length == 0 || pld.length == 0 )
			throw new IllegalArgumentException( "LD or PLD list of values must be provided." );

		final RandomAccessibleInterval< ? extends RealType< ? > > pcasl = firstEcho( aslData );

		if ( pcasl.dimension( ASLData.PLD_DIM ) != pld.length )
			throw new IllegalArgumentException(
					"pcasl has " + pcasl.dimension( ASLData.PLD_DIM ) + " delays, but " + pld.length + " PLD values are given." );

		LOG.info( "Creating CBF/ATT maps, {}, {}", descriptor, constants );

		final VoxelFitResult result = fit(
				new CBFProblem( Views.zeroMin( aslData.getM0() ), pcasl, ld, pld, new BuxtonModel( constants ) ),
				settings( params.par0, params.lb, params.ub, params ),
				params,
				"CBF/ATT fit" );

		cbfMap = result.map( 0 );
		attMap = result.map( 1 );

		final Map< String, RandomAccessibleInterval< DoubleType > > maps = new LinkedHashMap<>();
		// callers get copies, the stored maps stay untouched
		maps.put( CBF, scaled( cbfMap, 1.0 ) );
		maps.put( CBF_NORM, scaled( cbfMap, CBF_NORM_FACTOR ) );
		maps.put( ATT, scaled( attMap, 1.0 ) );

		return maps;
	}

	static RandomAccessibleInterval< ? extends RealType< ? > > firstEcho( final ASLData aslData )
	{
		final RandomAccessibleInterval< ? extends RealType< ? > > pcasl = aslData.getPcasl();

		if ( pcasl.numDimensions() == 5 )
			return Views.zeroMin( Views.hyperSlice( pcasl, ASLData.TE_DIM, pcasl.min( ASLData.TE_DIM ) ) );

		return Views.zeroMin( pcasl );
	}

	/**
	 * Observed signal of a voxel is its pcasl value at each delay.
	 */
	static class CBFProblem implements VoxelProblem
	{
		final RandomAccessibleInterval< ? extends RealType< ? > > m0, pcasl;
		final double[] ld, pld;
		final BuxtonModel model;

		CBFProblem(
				final RandomAccessibleInterval< ? extends RealType< ? > > m0,
				final RandomAccessibleInterval< ? extends RealType< ? > > pcasl,
				final double[] ld,
				final double[] pld,
				final BuxtonModel model )
		{
			this.m0 = m0;
			this.pcasl = pcasl;
			this.ld = ld;
			this.pld = pld;
			this.model = model;
		}

		@Override
		public int numParameters() { return 2; }

		@Override
		public VoxelSampler createSampler()
		{
			final RandomAccess< ? extends RealType< ? > > m0Access = m0.randomAccess();
			final RandomAccess< ? extends RealType< ? > > pcaslAccess = pcasl.randomAccess();

			return ( x, y, z ) ->
			{
				m0Access.setPosition( new long[] { x, y, z } );
				final double m0Value = m0Access.get().getRealDouble();

				final double[] observed = new double[ pld.length ];

				pcaslAccess.setPosition( x, 0 );
				pcaslAccess.setPosition( y, 1 );
				pcaslAccess.setPosition( z, 2 );

				for ( int p = 0; p < pld.length; ++p )
				{
					pcaslAccess.setPosition( p, ASLData.PLD_DIM );
					observed[ p ] = pcaslAccess.get().getRealDouble();
				}

				return new VoxelData( observed, params -> model.predict( ld, pld, m0Value, params[ 0 ], params[ 1 ] ) );
			};
		}
	}
}
