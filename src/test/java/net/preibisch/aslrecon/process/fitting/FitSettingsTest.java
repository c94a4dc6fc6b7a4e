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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class FitSettingsTest
{
	@Test
	public void testClampAndCopies()
	{
		final double[] p0 = new double[] { 1e-5, 1000 };
		final FitSettings settings = new FitSettings( p0, new double[] { 0, 0 }, new double[] { 1, 5000 } );

		p0[ 1 ] = 3;
		assertEquals( 1000, settings.initialGuess()[ 1 ], 0 );
		assertEquals( FitSettings.defaultMaxIterations, settings.maxIterations() );

		assertArrayEquals( new double[] { 0, 5000 }, settings.clamp( new double[] { -2, 9000 } ), 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testSizeMismatch()
	{
		new FitSettings( new double[] { 1 }, new double[] { 0, 0 }, new double[] { 2, 2 } );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testEmpty()
	{
		new FitSettings( new double[ 0 ], new double[ 0 ], new double[ 0 ] );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testLowerNotBelowUpper()
	{
		new FitSettings( new double[] { 1 }, new double[] { 1 }, new double[] { 1 } );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInitialGuessOutside()
	{
		new FitSettings( new double[] { 3 }, new double[] { 0 }, new double[] { 2 } );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testNoBudget()
	{
		new FitSettings( new double[] { 1 }, new double[] { 0 }, new double[] { 2 }, 0, 10 );
	}
}
