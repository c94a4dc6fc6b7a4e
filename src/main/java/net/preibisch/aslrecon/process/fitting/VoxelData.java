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
 * What a {@link VoxelSampler} extracted for one voxel: the observed signal, the model with all
 * fixed inputs of that voxel bound, and optionally a voxel-specific initial guess.
 */
public class VoxelData
{
	final double[] observed;
	final ParametricFunction model;
	final double[] initialGuess;

	public VoxelData( final double[] observed, final ParametricFunction model )
	{
		this( observed, model, null );
	}

	/**
	 * @param initialGuess - start point for this voxel or null to use the shared one
	 */
	public VoxelData( final double[] observed, final ParametricFunction model, final double[] initialGuess )
	{
		this.observed = observed;
		this.model = model;
		this.initialGuess = initialGuess;
	}

	public double[] observed() { return observed; }
	public ParametricFunction model() { return model; }
	public double[] initialGuess() { return initialGuess; }
}
