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

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresFactory;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem.Evaluation;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.ConvergenceChecker;
import org.apache.commons.math3.util.Pair;

/**
 * {@link LeastSquaresFitter} on top of the commons-math Levenberg-Marquardt optimizer. Bounds
 * are enforced by clamping every trial point, the Jacobian is approximated by forward
 * differences.
 */
public class LevenbergMarquardtFitter implements LeastSquaresFitter
{
	// relative step of the finite differences, sqrt of machine epsilon
	public static final double SQRT_EPS = Math.sqrt( Math.ulp( 1.0 ) );

	private final LevenbergMarquardtOptimizer optimizer;
	private final double relativeCostTolerance;

	public LevenbergMarquardtFitter()
	{
		this( 1e-12 );
	}

	/**
	 * @param relativeCostTolerance - stop once the cost changes less than this fraction between iterations
	 */
	public LevenbergMarquardtFitter( final double relativeCostTolerance )
	{
		this.optimizer = new LevenbergMarquardtOptimizer();
		this.relativeCostTolerance = relativeCostTolerance;
	}

	@Override
	public double[] fit(
			final ParametricFunction model,
			final double[] observed,
			final double[] initialGuess,
			final FitSettings settings ) throws FitNotConvergedException
	{
		final ParameterValidator validator = point -> {
			for ( int d = point.getDimension(); d-- > 0; )
				point.setEntry( d, Math.max( settings.lower( d ), Math.min( settings.upper( d ), point.getEntry( d ) ) ) );
			return point;
		};

		final ConvergenceChecker< Evaluation > checker = ( iteration, previous, current ) ->
			Math.abs( previous.getCost() - current.getCost() ) <= relativeCostTolerance * Math.max( previous.getCost(), current.getCost() );

		final LeastSquaresProblem problem = LeastSquaresFactory.create(
				new NumericalJacobian( model, settings ),
				new ArrayRealVector( observed, false ),
				new ArrayRealVector( settings.clamp( initialGuess.clone() ), false ),
				new DiagonalMatrix( ones( observed.length ), false ),
				checker,
				settings.maxEvaluations(),
				settings.maxIterations(),
				false,
				validator );

		try
		{
			final Optimum optimum = optimizer.optimize( problem );
			final double[] fitted = optimum.getPoint().toArray();

			for ( final double p : fitted )
				if ( Double.isNaN( p ) )
					throw new FitNotConvergedException( "Solver ended on a NaN parameter after " + optimum.getIterations() + " iterations." );

			return fitted;
		}
		catch ( final MathIllegalStateException e )
		{
			// too many iterations/evaluations, tolerances that cannot be met
			throw new FitNotConvergedException( e.getMessage(), e );
		}
	}

	private static double[] ones( final int n )
	{
		final double[] w = new double[ n ];
		for ( int i = 0; i < n; ++i )
			w[ i ] = 1.0;
		return w;
	}

	/**
	 * Forward differences, steps away from the upper bound if the forward point would cross it.
	 */
	static class NumericalJacobian implements MultivariateJacobianFunction
	{
		final ParametricFunction model;
		final FitSettings settings;

		NumericalJacobian( final ParametricFunction model, final FitSettings settings )
		{
			this.model = model;
			this.settings = settings;
		}

		@Override
		public Pair< RealVector, RealMatrix > value( final RealVector point )
		{
			final double[] p = point.toArray();
			final double[] f0 = model.value( p );
			final double[][] jacobian = new double[ f0.length ][ p.length ];

			for ( int d = 0; d < p.length; ++d )
			{
				double h = SQRT_EPS * Math.max( 1.0, Math.abs( p[ d ] ) );

				if ( p[ d ] + h > settings.upper( d ) )
					h = -h;

				final double[] shifted = p.clone();
				shifted[ d ] += h;
				final double[] f1 = model.value( shifted );

				for ( int i = 0; i < f0.length; ++i )
					jacobian[ i ][ d ] = ( f1[ i ] - f0[ i ] ) / h;
			}

			return new Pair<>( new ArrayRealVector( f0, false ), new Array2DRowRealMatrix( jacobian, false ) );
		}
	}
}
