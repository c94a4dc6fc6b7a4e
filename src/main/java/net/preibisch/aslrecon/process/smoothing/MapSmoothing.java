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
package net.preibisch.aslrecon.process.smoothing;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.algorithm.gauss3.Gauss3;
import net.imglib2.algorithm.neighborhood.Neighborhood;
import net.imglib2.algorithm.neighborhood.RectangleShape;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Spatial smoothing of output maps. Every map is filtered per 3D (x, y, z) volume, maps with
 * more dimensions (e.g. one T2 volume per delay) are filtered volume by volume, maps with
 * fewer dimensions are not filtered.
 */
public class MapSmoothing
{
	private static final Logger LOG = LoggerFactory.getLogger( MapSmoothing.class );

	public static double defaultSigma = 1.0;
	public static int defaultSize = 3;

	private MapSmoothing() {}

	/**
	 * @param maps - the output maps
	 * @param smoothing - "gaussian", "median" or null for no smoothing
	 * @param params - "sigma" for gaussian, "size" for median, may be null
	 * @return maps if smoothing is null, otherwise a new map of new images
	 */
	public static Map< String, RandomAccessibleInterval< DoubleType > > apply(
			final Map< String, RandomAccessibleInterval< DoubleType > > maps,
			final String smoothing,
			final Map< String, ? extends Number > params )
	{
		final SmoothingFilter filter = SmoothingFilter.fromName( smoothing );

		if ( filter == null )
			return maps;

		final Map< String, RandomAccessibleInterval< DoubleType > > smoothed = new LinkedHashMap<>();

		switch ( filter )
		{
			case GAUSSIAN:
			{
				final double sigma = sigma( params );
				LOG.info( "Applying gaussian smoothing (sigma={}) to maps {}", sigma, maps.keySet() );
				maps.forEach( ( name, map ) -> smoothed.put( name, isVolume( map ) ? gauss( map, sigma ) : map ) );
				break;
			}
			case MEDIAN:
			{
				final int size = size( params );
				LOG.info( "Applying median smoothing (size={}) to maps {}", size, maps.keySet() );
				maps.forEach( ( name, map ) -> smoothed.put( name, isVolume( map ) ? median( map, size ) : map ) );
				break;
			}
		}

		return smoothed;
	}

	public static RandomAccessibleInterval< DoubleType > gauss( final RandomAccessibleInterval< DoubleType > input, final double sigma )
	{
		if ( !( sigma > 0 ) || Double.isInfinite( sigma ) )
			throw new IllegalArgumentException( "sigma must be a positive number." );

		final RandomAccessibleInterval< DoubleType > output = ArrayImgs.doubles( Intervals.dimensionsAsLongArray( input ) );
		final RandomAccessibleInterval< DoubleType > source = Views.zeroMin( input );

		for ( final long[] slice : volumes( source ) )
			Gauss3.gauss( sigma, Views.extendBorder( volume( source, slice ) ), volume( output, slice ) );

		return output;
	}

	public static RandomAccessibleInterval< DoubleType > median( final RandomAccessibleInterval< DoubleType > input, int size )
	{
		if ( size <= 0 )
			throw new IllegalArgumentException( "size must be a positive integer." );

		if ( size % 2 == 0 )
		{
			LOG.warn( "size was even, using 3 instead" );
			size = 3;
		}

		final RandomAccessibleInterval< DoubleType > output = ArrayImgs.doubles( Intervals.dimensionsAsLongArray( input ) );
		final RandomAccessibleInterval< DoubleType > source = Views.zeroMin( input );
		final RectangleShape shape = new RectangleShape( size / 2, false );

		for ( final long[] slice : volumes( source ) )
		{
			final RandomAccess< Neighborhood< DoubleType > > neighborhoods =
					shape.neighborhoodsRandomAccessible( Views.extendBorder( volume( source, slice ) ) ).randomAccess();
			final Cursor< DoubleType > out = Views.flatIterable( volume( output, slice ) ).localizingCursor();

			double[] values = new double[ 0 ];

			while ( out.hasNext() )
			{
				out.fwd();
				neighborhoods.setPosition( out );

				final Neighborhood< DoubleType > neighborhood = neighborhoods.get();
				if ( values.length != neighborhood.size() )
					values = new double[ (int)neighborhood.size() ];

				int i = 0;
				for ( final DoubleType t : neighborhood )
					values[ i++ ] = t.get();

				Arrays.sort( values );
				out.get().set( values[ values.length / 2 ] );
			}
		}

		return output;
	}

	/*
	 * summaries such as per-delay means are passed through untouched
	 */
	static boolean isVolume( final RandomAccessibleInterval< ? > map )
	{
		return map.numDimensions() >= 3;
	}

	/**
	 * Checks the filter name and its parameters without smoothing anything.
	 *
	 * @throws IllegalArgumentException for an unknown filter, a sigma that is not positive or a size that is not a positive integer
	 */
	public static void validate( final String smoothing, final Map< String, ? extends Number > params )
	{
		final SmoothingFilter filter = SmoothingFilter.fromName( smoothing );

		if ( filter == SmoothingFilter.GAUSSIAN )
			sigma( params );
		else if ( filter == SmoothingFilter.MEDIAN )
			size( params );
	}

	static double sigma( final Map< String, ? extends Number > params )
	{
		if ( params == null || !params.containsKey( "sigma" ) )
			return defaultSigma;

		final Number sigma = params.get( "sigma" );

		if ( sigma == null || !( sigma.doubleValue() > 0 ) || Double.isInfinite( sigma.doubleValue() ) )
			throw new IllegalArgumentException( "sigma must be a positive number." );

		return sigma.doubleValue();
	}

	static int size( final Map< String, ? extends Number > params )
	{
		if ( params == null || !params.containsKey( "size" ) )
			return defaultSize;

		final Number size = params.get( "size" );

		if ( size == null || size.doubleValue() <= 0 || size.doubleValue() != Math.rint( size.doubleValue() ) )
			throw new IllegalArgumentException( "size must be a positive integer." );

		return size.intValue();
	}

	/*
	 * the positions of all 3D volumes in the dimensions beyond z, a single empty array for 3D images
	 */
	static long[][] volumes( final RandomAccessibleInterval< ? > img )
	{
		final int n = img.numDimensions();

		if ( n <= 3 )
			return new long[][] { new long[ 0 ] };

		long count = 1;
		for ( int d = 3; d < n; ++d )
			count *= img.dimension( d );

		final long[][] positions = new long[ (int)count ][ n - 3 ];

		for ( int i = 1; i < count; ++i )
		{
			positions[ i ] = positions[ i - 1 ].clone();

			for ( int d = 0; d < n - 3; ++d )
			{
				if ( ++positions[ i ][ d ] < img.dimension( d + 3 ) )
					break;

				positions[ i ][ d ] = 0;
			}
		}

		return positions;
	}

	static < T > RandomAccessibleInterval< T > volume( final RandomAccessibleInterval< T > img, final long[] position )
	{
		RandomAccessibleInterval< T > volume = img;

		// slice from the last dimension down so the remaining indices stay valid
		for ( int d = position.length - 1; d >= 0; --d )
			volume = Views.hyperSlice( volume, d + 3, position[ d ] );

		return volume;
	}
}
