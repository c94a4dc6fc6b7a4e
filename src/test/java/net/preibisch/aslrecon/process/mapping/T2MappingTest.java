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

import static net.preibisch.aslrecon.process.mapping.Phantoms.at;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.Map;

import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import net.preibisch.aslrecon.process.acquisition.ASLData;
import net.preibisch.aslrecon.process.acquisition.AcquisitionDescriptor;

public class T2MappingTest
{
	static final double[] LD = new double[] { 1800, 1800 };
	static final double[] PLD = new double[] { 200, 1000 };

	private static ASLData decay( final ArrayImg< FloatType, FloatArray > pcasl )
	{
		return new ASLData( pcasl, Phantoms.constant( 1000, 5, 4, 3 ), new AcquisitionDescriptor( LD, PLD, Phantoms.TE ) );
	}

	private static T2MappingParameters singleWorker()
	{
		final T2MappingParameters params = new T2MappingParameters();
		params.numWorkers = 1;
		return params;
	}

	@Test
	public void testRecoversT2PerDelay()
	{
		final T2Mapping mapping = new T2Mapping( decay( Phantoms.decay( 5, 4, 3, 500, 60, 90 ) ) );

		assertNull( mapping.getT2Maps() );
		assertNull( mapping.getMeanT2s() );

		final Map< String, RandomAccessibleInterval< DoubleType > > maps = mapping.createMap( singleWorker() );

		assertArrayEquals( new long[] { 5, 4, 3, 2 }, Intervals.dimensionsAsLongArray( maps.get( T2Mapping.T2 ) ) );
		assertEquals( 60, at( maps.get( T2Mapping.T2 ), 4, 3, 2, 0 ), 0.6 );
		assertEquals( 90, at( maps.get( T2Mapping.T2 ), 0, 1, 2, 1 ), 0.9 );

		assertArrayEquals( new double[] { 60, 90 }, mapping.getMeanT2s(), 0.9 );
		assertEquals( 2, maps.get( T2Mapping.MEAN_T2 ).dimension( 0 ) );
		assertEquals( 90, at( maps.get( T2Mapping.MEAN_T2 ), 1 ), 0.9 );
	}

	@Test
	public void testSignalBelowNoiseFloor()
	{
		final T2Mapping mapping = new T2Mapping( decay( Phantoms.decay( 5, 4, 3, 0, 60, 90 ) ) );
		final Map< String, RandomAccessibleInterval< DoubleType > > maps = mapping.createMap( singleWorker() );

		for ( final DoubleType t : Views.flatIterable( maps.get( T2Mapping.T2 ) ) )
			assertEquals( 0, t.get(), 0 );

		assertArrayEquals( new double[] { 0, 0 }, mapping.getMeanT2s(), 0 );
		assertEquals( mapping.getLastStatistics().masked(), mapping.getLastStatistics().rejected() );
	}

	@Test
	public void testNaNVoxel()
	{
		final ArrayImg< FloatType, FloatArray > pcasl = Phantoms.decay( 5, 4, 3, 500, 60, 90 );
		final RandomAccess< FloatType > ra = pcasl.randomAccess();
		ra.setPosition( new long[] { 1, 1, 1, 0, 2 } );
		ra.get().set( Float.NaN );

		final Map< String, RandomAccessibleInterval< DoubleType > > maps = new T2Mapping( decay( pcasl ) ).createMap( singleWorker() );

		assertEquals( 0, at( maps.get( T2Mapping.T2 ), 1, 1, 1, 0 ), 0 );
		assertEquals( 90, at( maps.get( T2Mapping.T2 ), 1, 1, 1, 1 ), 0.9 );
	}

	@Test
	public void testRejectsDiffusionWeighting()
	{
		final AcquisitionDescriptor descriptor = new AcquisitionDescriptor( LD, PLD, Phantoms.TE, new double[] { 50, 100 } );

		try
		{
			new T2Mapping( new ASLData( Phantoms.decay( 5, 4, 3, 500, 60, 90 ), null, descriptor ) );
			fail();
		}
		catch ( final IllegalArgumentException e )
		{
			assertEquals( "ASLData must not include DW values.", e.getMessage() );
		}
	}

	@Test
	public void testRequiresEchoTimes()
	{
		try
		{
			new T2Mapping( new ASLData( Phantoms.constant( 1, 5, 4, 3, 2 ), null, new AcquisitionDescriptor( LD, PLD ) ) );
			fail();
		}
		catch ( final IllegalArgumentException e )
		{
			assertEquals( "ASLData must provide TE and PLD values.", e.getMessage() );
		}
	}
}
