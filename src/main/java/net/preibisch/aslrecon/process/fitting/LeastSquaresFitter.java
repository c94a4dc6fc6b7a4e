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

/**
 * Bounded nonlinear least-squares. Implementations have to be thread-safe, one instance is
 * shared by all workers of a {@link VoxelFitScheduler}.
 */
public interface LeastSquaresFitter
{
	/**
	 * @param model - the function to fit
	 * @param observed - the observed signal
	 * @param initialGuess - start point, within the bounds of settings
	 * @param settings - bounds and budget
	 * @return the fitted parameters
	 * @throws FitNotConvergedException if the solver gives up
	 */
	double[] fit( ParametricFunction model, double[] observed, double[] initialGuess, FitSettings settings ) throws FitNotConvergedException;
}
