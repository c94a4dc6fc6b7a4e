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

import java.util.Arrays;

/**
 * Initial guess, bounds and solver budget shared by all voxels of a run. Immutable, all
 * arrays are copied in and out.
 */
public class FitSettings
{
	public static int defaultMaxIterations = 1000;
	public static int defaultMaxEvaluations = 5000;

	private final double[] initialGuess, lower, upper;
	private final int maxIterations, maxEvaluations;

	public FitSettings( final double[] initialGuess, final double[] lower, final double[] upper )
	{
		this( initialGuess, lower, upper, defaultMaxIterations, defaultMaxEvaluations );
	}

	/**
	 * @throws IllegalArgumentException if the sizes differ, a bound is NaN, lower &gt; upper or
	 * the initial guess lies outside the bounds
	 */
	public FitSettings(
			final double[] initialGuess,
			final double[] lower,
			final double[] upper,
			final int maxIterations,
			final int maxEvaluations )
	{
		if ( initialGuess == null || lower == null || upper == null )
			throw new IllegalArgumentException( "Initial guess, lower and upper bounds must be provided." );

		if ( initialGuess.length == 0 || initialGuess.length != lower.length || initialGuess.length != upper.length )
			throw new IllegalArgumentException(
					"Initial guess and bounds must have the same, non-zero size: " + Arrays.toString( initialGuess ) +
					", lb=" + Arrays.toString( lower ) + ", ub=" + Arrays.toString( upper ) );

		for ( int i = 0; i < initialGuess.length; ++i )
		{
			if ( Double.isNaN( lower[ i ] ) || Double.isNaN( upper[ i ] ) || lower[ i ] >= upper[ i ] )
				throw new IllegalArgumentException( "Each lower bound must be strictly less than the upper bound: lb=" +
						Arrays.toString( lower ) + ", ub=" + Arrays.toString( upper ) );

			if ( !( initialGuess[ i ] >= lower[ i ] && initialGuess[ i ] <= upper[ i ] ) )
				throw new IllegalArgumentException( "Initial guess " + Arrays.toString( initialGuess ) + " is outside of the bounds lb=" +
						Arrays.toString( lower ) + ", ub=" + Arrays.toString( upper ) );
		}

		if ( maxIterations < 1 || maxEvaluations < 1 )
			throw new IllegalArgumentException( "Iteration and evaluation budgets must be positive." );

		this.initialGuess = initialGuess.clone();
		this.lower = lower.clone();
		this.upper = upper.clone();
		this.maxIterations = maxIterations;
		this.maxEvaluations = maxEvaluations;
	}

	public int numParameters() { return initialGuess.length; }
	public double[] initialGuess() { return initialGuess.clone(); }
	public double[] lower() { return lower.clone(); }
	public double[] upper() { return upper.clone(); }
	public double lower( final int d ) { return lower[ d ]; }
	public double upper( final int d ) { return upper[ d ]; }
	public int maxIterations() { return maxIterations; }
	public int maxEvaluations() { return maxEvaluations; }

	/**
	 * @return the point, clamped into the bounds in place
	 */
	public double[] clamp( final double[] point )
	{
		for ( int d = 0; d < point.length; ++d )
			point[ d ] = Math.max( lower[ d ], Math.min( upper[ d ], point[ d ] ) );

		return point;
	}

	@Override
	public String toString()
	{
		return "p0=" + Arrays.toString( initialGuess ) + ", lb=" + Arrays.toString( lower ) + ", ub=" + Arrays.toString( upper ) +
				", maxIterations=" + maxIterations + ", maxEvaluations=" + maxEvaluations;
	}
}
