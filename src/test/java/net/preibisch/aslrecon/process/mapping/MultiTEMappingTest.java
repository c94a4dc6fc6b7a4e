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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Map;

import org.junit.Test;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import net.preibisch.aslrecon.process.acquisition.ASLData;
import net.preibisch.aslrecon.process.acquisition.AcquisitionDescriptor;

public class MultiTEMappingTest
{
	static final double M0 = 1000, CBF = 2e-5, ATT = 1500, T1BLGM = 300;

	private static ASLData phantom( final long sx, final long sy, final long sz )
	{
		return new ASLData(
				Phantoms.multiTE( sx, sy, sz, M0, CBF, ATT, T1BLGM ),
				Phantoms.constant( M0, sx, sy, sz ),
				new AcquisitionDescriptor( Phantoms.LD, Phantoms.PLD, Phantoms.TE ) );
	}

	private static MultiTEMappingParameters singleWorker()
	{
		final MultiTEMappingParameters params = new MultiTEMappingParameters();
		params.numWorkers = 1;
		return params;
	}

	@Test
	public void testRecoversExchangeTimeWithSuppliedMaps()
	{
		final MultiTEMapping mapping = new MultiTEMapping( phantom( 4, 4, 2 ) );
		mapping.setCbfMap( Phantoms.constant( CBF, 4, 4, 2 ) );
		mapping.setAttMap( Phantoms.constant( ATT, 4, 4, 2 ) );

		final Map< String, RandomAccessibleInterval< DoubleType > > maps = mapping.createMap( singleWorker() );

		assertArrayEquals( new Object[] { "cbf", "cbf_norm", "att", "t1blgm" }, maps.keySet().toArray() );

		for ( final DoubleType t : Views.flatIterable( maps.get( MultiTEMapping.T1BLGM ) ) )
			assertEquals( T1BLGM, t.get(), 0.05 * T1BLGM );

		// supplied maps are passed through
		assertEquals( CBF, at( maps.get( CBFMapping.CBF ), 3, 3, 1 ), 1e-9 );
		assertEquals( ATT, at( maps.get( CBFMapping.ATT ), 0, 1, 0 ), 1e-6 );
		assertEquals( 32, mapping.getLastStatistics().masked() );
	}

	@Test
	public void testComputesMissingMaps()
	{
		final MultiTEMapping mapping = new MultiTEMapping( phantom( 3, 3, 2 ) );

		assertNull( mapping.getCbfMap() );

		final Map< String, RandomAccessibleInterval< DoubleType > > maps = mapping.createMap( singleWorker() );

		assertNotNull( mapping.getCbfMap() );
		assertNotNull( mapping.getAttMap() );
		assertTrue( at( maps.get( CBFMapping.CBF ), 1, 1, 1 ) > 0 );
		assertTrue( at( maps.get( CBFMapping.ATT ), 1, 1, 1 ) > 0 );

		for ( final DoubleType t : Views.flatIterable( maps.get( MultiTEMapping.T1BLGM ) ) )
			assertTrue( t.get() >= 0 && t.get() <= 4 * 400 );
	}

	@Test
	public void testComputedMapsFollowSettings()
	{
		final MultiTEMapping mapping = new MultiTEMapping( phantom( 2, 2, 1 ) );

		mapping.createMap( singleWorker() );
		final RandomAccessibleInterval< DoubleType > cbf = mapping.getCbfMap();

		// same settings, the maps are reused
		mapping.createMap( singleWorker() );
		assertSame( cbf, mapping.getCbfMap() );

		mapping.setConstant( 1500, "T1bl" );
		mapping.createMap( singleWorker() );
		assertNotSame( cbf, mapping.getCbfMap() );

		final RandomAccessibleInterval< DoubleType > refitted = mapping.getCbfMap();
		final MultiTEMappingParameters params = singleWorker();
		params.cbfParameters.par0 = new double[] { 3e-5, 1200 };
		mapping.createMap( params );
		assertNotSame( refitted, mapping.getCbfMap() );
	}

	@Test
	public void testReturnedMapsAreCopies()
	{
		final MultiTEMapping mapping = new MultiTEMapping( phantom( 2, 2, 1 ) );
		mapping.setCbfMap( Phantoms.constant( CBF, 2, 2, 1 ) );
		mapping.setAttMap( Phantoms.constant( ATT, 2, 2, 1 ) );

		final Map< String, RandomAccessibleInterval< DoubleType > > maps = mapping.createMap( singleWorker() );

		for ( final String name : maps.keySet() )
			for ( final DoubleType t : Views.flatIterable( maps.get( name ) ) )
				t.set( -1 );

		assertEquals( CBF, at( mapping.getCbfMap(), 1, 1, 0 ), 1e-9 );
		assertEquals( ATT, at( mapping.getAttMap(), 1, 1, 0 ), 1e-6 );
		assertTrue( at( mapping.getT1blgmMap(), 1, 1, 0 ) >= 0 );
	}

	@Test
	public void testSingleSuppliedMapIsKept()
	{
		final MultiTEMapping mapping = new MultiTEMapping( phantom( 2, 2, 2 ) );
		mapping.setCbfMap( Phantoms.constant( 3e-5, 2, 2, 2 ) );

		mapping.createMap( singleWorker() );

		assertEquals( 3e-5, at( mapping.getCbfMap(), 1, 0, 1 ), 1e-10 );
		assertTrue( at( mapping.getAttMap(), 1, 0, 1 ) > 0 );
	}

	@Test
	public void testSuppliedMapShape()
	{
		final MultiTEMapping mapping = new MultiTEMapping( phantom( 2, 2, 2 ) );

		try
		{
			mapping.setAttMap( Phantoms.constant( ATT, 2, 2, 3 ) );
			fail();
		}
		catch ( final IllegalArgumentException e )
		{
			assertTrue( e.getMessage().startsWith( "ATT map dimension does not match" ) );
		}
	}

	@Test
	public void testRequiresEchoTimes()
	{
		final ASLData data = new ASLData(
				Phantoms.buxton( 2, 2, 2, M0, CBF, ATT ),
				Phantoms.constant( M0, 2, 2, 2 ),
				new AcquisitionDescriptor( Phantoms.LD, Phantoms.PLD ) );

		try
		{
			new MultiTEMapping( data );
			fail();
		}
		catch ( final IllegalArgumentException e )
		{
			assertEquals( "ASLData is incomplete. MultiTEMapping need a list of TE values.", e.getMessage() );
		}
	}

	@Test
	public void testClip()
	{
		final double[] values = new double[] { -3, 10, 5000, Double.NaN };
		MultiTEMapping.clip( values, 0, 1600 );

		assertArrayEquals( new double[] { 0, 10, 1600, 0 }, values, 0 );
	}
}
