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
 * The general kinetic model for pCASL.
 * <p>
 * Buxton RB, et al. "A general kinetic model for quantitative perfusion imaging with arterial
 * spin labeling", Magn Reson Med (1998). Free parameters are the blood flow (cbf, in model units,
 * ml/g/ms) and the arterial transit time (att, ms).
 */
public class BuxtonModel
{
	final double t1b, alpha, lambda;

	public BuxtonModel( final double t1b, final double alpha, final double lambda )
	{
		this.t1b = t1b;
		this.alpha = alpha;
		this.lambda = lambda;
	}

	public BuxtonModel( final MRIParameters parameters )
	{
		this( parameters.t1Blood(), parameters.alpha(), parameters.lambda() );
	}

	public double[] predict( final double[] ld, final double[] pld, final double m0, final double cbf, final double att )
	{
		return predict( ld, pld, m0, cbf, att, t1b, alpha, lambda );
	}

	/**
	 * @param ld - labeling durations (ms)
	 * @param pld - post-labeling delays (ms), same length as ld
	 * @param m0 - the reference intensity of the voxel
	 * @param cbf - blood flow
	 * @param att - arterial transit time (ms)
	 * @param t1b - T1 of blood (ms)
	 * @param alpha - labeling efficiency
	 * @param lambda - blood-brain partition coefficient
	 * @return the predicted signal per (ld, pld) condition
	 */
	public static double[] predict(
			final double[] ld,
			final double[] pld,
			final double m0,
			final double cbf,
			final double att,
			final double t1b,
			final double alpha,
			final double lambda )
	{
		checkTiming( ld, pld );

		final double t1prime = effectiveT1( t1b, cbf, lambda );
		final double[] signal = new double[ ld.length ];

		for ( int i = 0; i < ld.length; ++i )
		{
			final double t = ld[ i ] + pld[ i ];
			final double s;

			if ( t < att )
				s = 0;
			else if ( t < ld[ i ] + att )
				s = 2.0 * alpha * m0 * cbf * t1prime * Math.exp( -att / t1b ) * ( 1.0 - Math.exp( -( t - att ) / t1prime ) );
			else
				s = 2.0 * alpha * m0 * cbf * t1prime * Math.exp( -att / t1b ) * ( 1.0 - Math.exp( -ld[ i ] / t1prime ) ) *
						Math.exp( -( t - ld[ i ] - att ) / t1prime );

			signal[ i ] = finiteOrZero( s );
		}

		return signal;
	}

	/**
	 * @return T1' = 1 / (1/T1b + cbf/lambda), the apparent T1 of labeled water in tissue
	 */
	public static double effectiveT1( final double t1b, final double cbf, final double lambda )
	{
		return 1.0 / ( 1.0 / t1b + cbf / lambda );
	}

	static double finiteOrZero( final double value )
	{
		return Double.isNaN( value ) || Double.isInfinite( value ) ? 0.0 : value;
	}

	static void checkTiming( final double[] ld, final double[] pld )
	{
		if ( ld == null )
			throw new IllegalArgumentException( "ld parameter must be an array of values." );

		if ( pld == null )
			throw new IllegalArgumentException( "pld parameter must be an array of values." );

		if ( ld.length != pld.length )
			throw new IllegalArgumentException( "ld and pld must have the same size (" + ld.length + " != " + pld.length + ")." );
	}
}
