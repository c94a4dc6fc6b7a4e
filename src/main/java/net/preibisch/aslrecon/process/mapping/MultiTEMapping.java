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
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import net.preibisch.aslrecon.process.acquisition.ASLData;
import net.preibisch.aslrecon.process.acquisition.AcquisitionDescriptor;
import net.preibisch.aslrecon.process.acquisition.MRIParameters;
import net.preibisch.aslrecon.process.fitting.VoxelData;
import net.preibisch.aslrecon.process.fitting.VoxelFitResult;
import net.preibisch.aslrecon.process.fitting.VoxelProblem;
import net.preibisch.aslrecon.process.fitting.VoxelSampler;
import net.preibisch.aslrecon.process.models.MultiTEModel;

/**
 * Fits the blood to grey-matter exchange time (T1blGM) of multi-echo data with CBF and ATT
 * held fixed per voxel. CBF and ATT maps can be supplied; if not, they are computed first
 * with a {@link CBFMapping} that shares mask, constants and workers with this mapping.
 * <p>
 * Produces "cbf", "cbf_norm", "att" and "t1blgm" (ms). T1blGM is clipped to
 * [0, clipFactor * initial guess].
 */
public class MultiTEMapping extends ASLMapping
{
	private static final Logger LOG = LoggerFactory.getLogger( MultiTEMapping.class );

	public static final String T1BLGM = "t1blgm";

	private RandomAccessibleInterval< DoubleType > cbfMap, attMap, t1blgmMap;

	// set by the user, never replaced
	private boolean cbfSupplied = false, attSupplied = false;

	// computed internally, replaced when the mask, the constants or the CBF fit settings change
	private boolean mapsComputed = false;
	private MRIParameters computedConstants;
	private double[][] computedSettings;

	public MultiTEMapping( final ASLData aslData )
	{
		super( aslData );

		if ( aslData.getPcasl() == null || aslData.getM0() == null )
			throw new IllegalArgumentException( "ASLData is incomplete. CBFMapping need pcasl and m0 images." );

		if ( !aslData.getDescriptor().hasTe() )
			throw new IllegalArgumentException( "ASLData is incomplete. MultiTEMapping need a list of TE values." );

		if ( !aslData.isMultiEcho() )
			throw new IllegalArgumentException( "MultiTEMapping needs a 5D (x,y,z,pld,te) pcasl image." );
	}

	@Override
	public void setBrainMask( final RandomAccessibleInterval< ? extends RealType< ? > > mask, final int label )
	{
		super.setBrainMask( mask, label );
		mapsComputed = false;
	}

	public RandomAccessibleInterval< DoubleType > getCbfMap() { return cbfMap; }
	public RandomAccessibleInterval< DoubleType > getAttMap() { return attMap; }

	/**
	 * @return the last T1blGM map (unsmoothed), null before the first run
	 */
	public RandomAccessibleInterval< DoubleType > getT1blgmMap() { return t1blgmMap; }

	/**
	 * @param cbf - (x, y, z) CBF map in ml/g/ms, used as is by every following run
	 */
	public void setCbfMap( final RandomAccessibleInterval< ? extends RealType< ? > > cbf )
	{
		this.cbfMap = copyChecked( cbf, "CBF" );
		this.cbfSupplied = true;
	}

	/**
	 * @param att - (x, y, z) ATT map in ms, used as is by every following run
	 */
	public void setAttMap( final RandomAccessibleInterval< ? extends RealType< ? > > att )
	{
		this.attMap = copyChecked( att, "ATT" );
		this.attSupplied = true;
	}

	public Map< String, RandomAccessibleInterval< DoubleType > > createMap()
	{
		return createMap( new MultiTEMappingParameters() );
	}

	/**
	 * CBF and ATT maps computed by an earlier run are reused as long as the brain mask, the
	 * constants and the CBF fit settings (p0, bounds, budget) are unchanged.
	 *
	 * @return copies of "cbf", "cbf_norm", "att" and "t1blgm", (x, y, z) each
	 */
	public Map< String, RandomAccessibleInterval< DoubleType > > createMap( final MultiTEMappingParameters params )
	{
		validate( params );

		final AcquisitionDescriptor descriptor = aslData.getDescriptor();
		final double[] ld = descriptor.getLd();
		final double[] pld = descriptor.getPld();
		final double[] te = descriptor.getTe();

		if ( ld.length == 0 || pld.length == 0 )
			throw new IllegalArgumentException( "LD or PLD list of values must be provided." );

		if ( te == null || te.length == 0 )
			throw new IllegalArgumentException( "ASLData is incomplete. MultiTEMapping need a list of TE values." );

		final RandomAccessibleInterval< ? extends RealType< ? > > pcasl = Views.zeroMin( aslData.getPcasl() );

		if ( pcasl.dimension( ASLData.PLD_DIM ) != pld.length || pcasl.dimension( ASLData.TE_DIM ) != te.length )
			throw new IllegalArgumentException(
					"pcasl dimensions " + Arrays.toString( Intervals.dimensionsAsLongArray( pcasl ) ) + " do not match " +
					pld.length + " PLD and " + te.length + " TE values." );

		if ( !( cbfSupplied && attSupplied ) && !computedMapsValid( params ) )
			computeCbfAtt( params );

		LOG.info( "Creating T1blGM map, {}, {}", descriptor, constants );

		final VoxelFitResult result = fit(
				new MultiTEProblem( Views.zeroMin( aslData.getM0() ), pcasl, cbfMap, attMap, ld, pld, te, new MultiTEModel( constants ) ),
				settings( params.par0, params.lb, params.ub, params ),
				params,
				"T1blGM fit" );

		t1blgmMap = result.map( 0 );
		clip( result.buffer( 0 ), 0.0, params.clipFactor * params.par0[ 0 ] );

		final Map< String, RandomAccessibleInterval< DoubleType > > maps = new LinkedHashMap<>();
		// callers get copies, cbf and att are fixed inputs of the next run
		maps.put( CBFMapping.CBF, scaled( cbfMap, 1.0 ) );
		maps.put( CBFMapping.CBF_NORM, scaled( cbfMap, CBFMapping.CBF_NORM_FACTOR ) );
		maps.put( CBFMapping.ATT, scaled( attMap, 1.0 ) );
		maps.put( T1BLGM, scaled( t1blgmMap, 1.0 ) );

		return smooth( maps, params );
	}

	protected void computeCbfAtt( final MultiTEMappingParameters params )
	{
		LOG.info( "The CBF/ATT map were not provided. Creating these maps before next step..." );

		final CBFMapping basic = new CBFMapping( aslData );
		basic.constants.setAll( constants );
		basic.brainMask = getBrainMask();

		final CBFMappingParameters cbfParams = params.cbfParameters.duplicate();
		cbfParams.numWorkers = params.numWorkers;
		cbfParams.smoothing = null;

		basic.computeMaps( cbfParams );

		// a map set by the user wins over the computed one
		if ( !cbfSupplied )
			cbfMap = basic.getCbfMap();

		if ( !attSupplied )
			attMap = basic.getAttMap();

		mapsComputed = true;
		computedConstants = new MRIParameters( constants );
		computedSettings = cbfSettings( cbfParams );
	}

	/*
	 * computed maps are reused only while mask, constants and CBF fit settings are those they were fitted with
	 */
	private boolean computedMapsValid( final MultiTEMappingParameters params )
	{
		return mapsComputed &&
				constants.equals( computedConstants ) &&
				Arrays.deepEquals( computedSettings, cbfSettings( params.cbfParameters ) );
	}

	private static double[][] cbfSettings( final CBFMappingParameters p )
	{
		return new double[][] { p.par0.clone(), p.lb.clone(), p.ub.clone(), { p.maxIterations, p.maxEvaluations } };
	}

	/**
	 * Values outside [min, max] are moved to the nearest bound, NaN becomes 0.
	 */
	static void clip( final double[] values, final double min, final double max )
	{
		for ( int i = 0; i < values.length; ++i )
		{
			if ( Double.isNaN( values[ i ] ) )
				values[ i ] = 0;
			else
				values[ i ] = Math.max( min, Math.min( max, values[ i ] ) );
		}
	}

	private RandomAccessibleInterval< DoubleType > copyChecked( final RandomAccessibleInterval< ? extends RealType< ? > > map, final String name )
	{
		if ( map == null )
			throw new IllegalArgumentException( name + " map is not an image. Type null" );

		final long[] expected = ASLData.spatialDimensions( spatialInterval() );

		if ( !Arrays.equals( Intervals.dimensionsAsLongArray( map ), expected ) )
			throw new IllegalArgumentException(
					name + " map dimension does not match with input 3D volume. Map shape " +
					Arrays.toString( Intervals.dimensionsAsLongArray( map ) ) + " not equal to " + Arrays.toString( expected ) );

		return scaled( map, 1.0 );
	}

	/**
	 * Observed signal of a voxel is its pcasl value for every (delay, echo) pair, delay-major.
	 */
	static class MultiTEProblem implements VoxelProblem
	{
		final RandomAccessibleInterval< ? extends RealType< ? > > m0, pcasl;
		final RandomAccessibleInterval< DoubleType > cbf, att;
		final double[] ld, pld, te;
		final MultiTEModel model;

		MultiTEProblem(
				final RandomAccessibleInterval< ? extends RealType< ? > > m0,
				final RandomAccessibleInterval< ? extends RealType< ? > > pcasl,
				final RandomAccessibleInterval< DoubleType > cbf,
				final RandomAccessibleInterval< DoubleType > att,
				final double[] ld,
				final double[] pld,
				final double[] te,
				final MultiTEModel model )
		{
			this.m0 = m0;
			this.pcasl = pcasl;
			this.cbf = Views.zeroMin( cbf );
			this.att = Views.zeroMin( att );
			this.ld = ld;
			this.pld = pld;
			this.te = te;
			this.model = model;
		}

		@Override
		public int numParameters() { return 1; }

		@Override
		public VoxelSampler createSampler()
		{
			final RandomAccess< ? extends RealType< ? > > m0Access = m0.randomAccess();
			final RandomAccess< ? extends RealType< ? > > pcaslAccess = pcasl.randomAccess();
			final RandomAccess< DoubleType > cbfAccess = cbf.randomAccess();
			final RandomAccess< DoubleType > attAccess = att.randomAccess();

			return ( x, y, z ) ->
			{
				final long[] position = new long[] { x, y, z };

				m0Access.setPosition( position );
				cbfAccess.setPosition( position );
				attAccess.setPosition( position );

				final double m0Value = m0Access.get().getRealDouble();
				final double cbfValue = cbfAccess.get().get();
				final double attValue = attAccess.get().get();

				final double[] observed = new double[ pld.length * te.length ];

				pcaslAccess.setPosition( x, 0 );
				pcaslAccess.setPosition( y, 1 );
				pcaslAccess.setPosition( z, 2 );

				for ( int p = 0; p < pld.length; ++p )
				{
					pcaslAccess.setPosition( p, ASLData.PLD_DIM );

					for ( int e = 0; e < te.length; ++e )
					{
						pcaslAccess.setPosition( e, ASLData.TE_DIM );
						observed[ p * te.length + e ] = pcaslAccess.get().getRealDouble();
					}
				}

				return new VoxelData( observed, params -> model.predict( ld, pld, te, m0Value, cbfValue, attValue, params[ 0 ] ) );
			};
		}
	}
}
