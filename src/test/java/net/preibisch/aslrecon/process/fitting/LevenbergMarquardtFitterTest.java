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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import net.preibisch.aslrecon.process.models.MonoExponentialModel;

public class LevenbergMarquardtFitterTest
{
	final LevenbergMarquardtFitter fitter = new LevenbergMarquardtFitter();

	@Test
	public void testExponentialDecay() throws FitNotConvergedException
	{
		final double[] te = new double[] { 10, 20, 40, 60, 90, 130 };
		final double[] observed = MonoExponentialModel.predict( te, 750, 55 );

		final FitSettings settings = new FitSettings(
				new double[] { 1, 80 },
				new double[] { 0, 0 },
				new double[] { Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY } );

		final double[] p = fitter.fit( params -> MonoExponentialModel.predict( te, params[ 0 ], params[ 1 ] ), observed, new double[] { 700, 80 }, settings );

		assertEquals( 750, p[ 0 ], 750 * 1e-4 );
		assertEquals( 55, p[ 1 ], 55 * 1e-4 );
	}

	@Test
	public void testBoundsAreRespected() throws FitNotConvergedException
	{
		final double[] t = new double[] { 0, 1, 2, 3 };
		final double[] observed = new double[] { 1, 3, 5, 7 }; // slope 2

		final FitSettings settings = new FitSettings( new double[] { 0.5 }, new double[] { 0 }, new double[] { 1 } );

		final double[] p = fitter.fit( params -> {
			final double[] y = new double[ t.length ];
			for ( int i = 0; i < t.length; ++i )
				y[ i ] = 1 + params[ 0 ] * t[ i ];
			return y;
		}, observed, settings.initialGuess(), settings );

		assertTrue( p[ 0 ] <= 1 );
		assertEquals( 1, p[ 0 ], 1e-6 );
	}

	@Test
	public void testInitialGuessOutsideBoundsIsClamped() throws FitNotConvergedException
	{
		final double[] observed = new double[] { 2, 2, 2 };
		final FitSettings settings = new FitSettings( new double[] { 1 }, new double[] { 0 }, new double[] { 10 } );

		final double[] p = fitter.fit( params -> new double[] { params[ 0 ], params[ 0 ], params[ 0 ] }, observed, new double[] { 50 }, settings );

		assertEquals( 2, p[ 0 ], 1e-8 );
	}

	@Test( expected = FitNotConvergedException.class )
	public void testBudgetExhausted() throws FitNotConvergedException
	{
		final double[] te = new double[] { 10, 20, 40, 60, 90, 130 };
		final double[] observed = MonoExponentialModel.predict( te, 750, 55 );

		final FitSettings settings = new FitSettings(
				new double[] { 1, 80 },
				new double[] { 0, 0 },
				new double[] { Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY },
				1, 1 );

		fitter.fit( params -> MonoExponentialModel.predict( te, params[ 0 ], params[ 1 ] ), observed, new double[] { 1, 80 }, settings );
	}
}
