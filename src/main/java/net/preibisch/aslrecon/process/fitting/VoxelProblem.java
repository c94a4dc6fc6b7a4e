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
 * The per-voxel fitting problem a {@link VoxelFitScheduler} solves: how many parameters,
 * how to read a voxel, which fits to keep. Implementations only hold read-only state.
 */
public interface VoxelProblem
{
	int numParameters();

	/**
	 * Called once per worker task, before its first voxel.
	 */
	VoxelSampler createSampler();

	/**
	 * @return false if a converged fit is physically meaningless and the voxel should get the fallback
	 */
	default boolean accept( final double[] fitted ) { return true; }
}
