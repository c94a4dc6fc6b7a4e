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
package net.preibisch.aslrecon.process.models;

import net.preibisch.aslrecon.process.acquisition.MRIParameters;

/**
 * Two-compartment multi-echo extension of the {@link BuxtonModel}. Labeled water that arrived
 * at the voxel stays in the vasculature for an exponentially distributed time with mean
 * t1blgm (the blood to grey matter exchange time) before it crosses into tissue. Both
 * compartments relax longitudinally with T1', transversally with T2 of blood and grey
 * matter respectively.
 * <p>
 * For TE = 0 the predicted signal equals the Buxton signal for the same cbf and att.
 * <p>
 * Petitclerc L, et al. "Ultra-long-TE arterial spin labeling reveals rapid and brain-wide
 * blood-to-CSF water transport in humans", NeuroImage (2021).
 */
public class MultiTEModel
{
	final double t1b, alpha, lambda, t2bl, t2gm;

	public MultiTEModel( final double t1b, final double alpha, final double lambda, final double t2bl, final double t2gm )
	{
		this.t1b = t1b;
		this.alpha = alpha;
		this.lambda = lambda;
		this.t2bl = t2bl;
		this.t2gm = t2gm;
	}

	public MultiTEModel( final MRIParameters parameters )
	{
		this( parameters.t1Blood(), parameters.alpha(), parameters.lambda(), parameters.t2Blood(), parameters.t2GreyMatter() );
	}

	/**
	 * @param ld - labeling durations (ms)
	 * @param pld - post-labeling delays (ms)
	 * @param te - echo times (ms)
	 * @param m0 - reference intensity of the voxel
	 * @param cbf - blood flow (fixed)
	 * @param att - arterial transit time (fixed)
	 * @param t1blgm - blood to grey matter exchange time (ms), the free parameter
	 * @return the signal for all pld.length * te.length conditions, index = pldIndex * te.length + teIndex
	 */
	public double[] predict(
			final double[] ld,
			final double[] pld,
			final double[] te,
			final double m0,
			final double cbf,
			final double att,
			final double t1blgm )
	{
		BuxtonModel.checkTiming( ld, pld );

		if ( te == null )
			throw new IllegalArgumentException( "te parameter must be an array of values." );

		final double t1prime = BuxtonModel.effectiveT1( t1b, cbf, lambda );
		final double kTotal = 1.0 / t1prime;
		final double kBlood = kTotal + 1.0 / t1blgm;
		final double scale = 2.0 * alpha * m0 * cbf * Math.exp( -att / t1b );

		final double[] signal = new double[ pld.length * te.length ];

		for ( int p = 0; p < pld.length; ++p )
		{
			final double t = ld[ p ] + pld[ p ];
			final double total, blood;

			if ( t < att )
			{
				total = blood = 0;
			}
			else
			{
				// residence times of the bolus elements present at time t
				final double sMax = t - att;
				final double sMin = Math.max( 0, t - att - ld[ p ] );

				total = BuxtonModel.finiteOrZero( scale * residence( kTotal, sMin, sMax ) );
				blood = t1blgm > 0 ? BuxtonModel.finiteOrZero( scale * residence( kBlood, sMin, sMax ) ) : 0;
			}

			final double tissue = total - blood;

			for ( int e = 0; e < te.length; ++e )
				signal[ p * te.length + e ] = BuxtonModel.finiteOrZero(
						blood * Math.exp( -te[ e ] / t2bl ) + tissue * Math.exp( -te[ e ] / t2gm ) );
		}

		return signal;
	}

	/*
	 * integral of exp(-k*s) ds from sMin to sMax
	 */
	private static double residence( final double k, final double sMin, final double sMax )
	{
		return ( Math.exp( -k * sMin ) - Math.exp( -k * sMax ) ) / k;
	}
}
