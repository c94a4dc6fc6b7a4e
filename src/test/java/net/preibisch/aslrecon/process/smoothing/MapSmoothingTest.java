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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;

public class MapSmoothingTest
{
	private static ArrayImg< DoubleType, DoubleArray > spike( final long... dim )
	{
		final ArrayImg< DoubleType, DoubleArray > img = ArrayImgs.doubles( dim );
		final RandomAccess< DoubleType > ra = img.randomAccess();
		ra.setPosition( new long[] { 3, 3, 3 } );
		ra.get().set( 100 );
		return img;
	}

	private static double at( final RandomAccessibleInterval< DoubleType > img, final long... position )
	{
		final RandomAccess< DoubleType > ra = img.randomAccess();
		ra.setPosition( position );
		return ra.get().get();
	}

	private static Map< String, RandomAccessibleInterval< DoubleType > > maps( final RandomAccessibleInterval< DoubleType > img )
	{
		final Map< String, RandomAccessibleInterval< DoubleType > > maps = new LinkedHashMap<>();
		maps.put( "cbf", img );
		return maps;
	}

	@Test
	public void testNoSmoothing()
	{
		final Map< String, RandomAccessibleInterval< DoubleType > > maps = maps( spike( 7, 7, 7 ) );
		assertSame( maps, MapSmoothing.apply( maps, null, null ) );
	}

	@Test
	public void testGaussianSpreadsAndKeepsInput()
	{
		final ArrayImg< DoubleType, DoubleArray > input = spike( 7, 7, 7 );
		final RandomAccessibleInterval< DoubleType > out = MapSmoothing.apply( maps( input ), "gaussian", Collections.singletonMap( "sigma", 1.0 ) ).get( "cbf" );

		assertArrayEquals( new long[] { 7, 7, 7 }, Intervals.dimensionsAsLongArray( out ) );
		assertTrue( at( out, 3, 3, 3 ) < 100 );
		assertTrue( at( out, 3, 3, 4 ) > 0 );
		assertEquals( 100, at( input, 3, 3, 3 ), 0 );
	}

	@Test
	public void testMedianRemovesSpike()
	{
		final RandomAccessibleInterval< DoubleType > out = MapSmoothing.apply( maps( spike( 7, 7, 7 ) ), "median", null ).get( "cbf" );
		assertEquals( 0, at( out, 3, 3, 3 ), 0 );
	}

	@Test
	public void testMedianPerVolume()
	{
		// a 4D stack is filtered per (x, y, z) volume, the spike lives in volume 0
		final ArrayImg< DoubleType, DoubleArray > stack = ArrayImgs.doubles( 7, 7, 7, 2 );
		for ( final DoubleType t : stack )
			t.set( 5 );

		final RandomAccessibleInterval< DoubleType > out = MapSmoothing.apply( maps( stack ), "median", Collections.singletonMap( "size", 4 ) ).get( "cbf" );

		assertArrayEquals( new long[] { 7, 7, 7, 2 }, Intervals.dimensionsAsLongArray( out ) );
		assertEquals( 5, at( out, 0, 0, 0, 1 ), 0 );
	}

	@Test
	public void testSummariesPassThrough()
	{
		final ArrayImg< DoubleType, DoubleArray > means = ArrayImgs.doubles( new double[] { 1, 2 }, 2 );
		final Map< String, RandomAccessibleInterval< DoubleType > > maps = maps( spike( 7, 7, 7 ) );
		maps.put( "mean", means );

		assertSame( means, MapSmoothing.apply( maps, "gaussian", null ).get( "mean" ) );
	}

	@Test
	public void testValidateWithoutSmoothing()
	{
		MapSmoothing.validate( null, Collections.singletonMap( "sigma", -1 ) );
		MapSmoothing.validate( "gaussian", null );
		MapSmoothing.validate( "median", Collections.singletonMap( "size", 4 ) );

		try
		{
			MapSmoothing.validate( "gaussian", Collections.singletonMap( "sigma", Double.POSITIVE_INFINITY ) );
			fail();
		}
		catch ( final IllegalArgumentException e )
		{
			assertEquals( "sigma must be a positive number.", e.getMessage() );
		}

		try
		{
			MapSmoothing.validate( "median", Collections.singletonMap( "size", -3 ) );
			fail();
		}
		catch ( final IllegalArgumentException e )
		{
			assertEquals( "size must be a positive integer.", e.getMessage() );
		}
	}

	@Test
	public void testInvalidParameters()
	{
		try
		{
			MapSmoothing.apply( maps( spike( 7, 7, 7 ) ), "bilateral", null );
			fail();
		}
		catch ( final IllegalArgumentException e )
		{
			assertTrue( e.getMessage().startsWith( "Unsupported smoothing type: bilateral" ) );
		}

		try
		{
			MapSmoothing.apply( maps( spike( 7, 7, 7 ) ), "gaussian", Collections.singletonMap( "sigma", -1 ) );
			fail();
		}
		catch ( final IllegalArgumentException e )
		{
			assertEquals( "sigma must be a positive number.", e.getMessage() );
		}

		try
		{
			MapSmoothing.apply( maps( spike( 7, 7, 7 ) ), "median", Collections.singletonMap( "size", 0 ) );
			fail();
		}
		catch ( final IllegalArgumentException e )
		{
			assertEquals( "size must be a positive integer.", e.getMessage() );
		}
	}
}
