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

/**
 * Parameters of the mono-exponential T2 fit, order of the arrays is (s0, t2).
 */
public class T2MappingParameters extends MappingParameters
{
	/**
	 * voxels whose maximum signal over TE is below this are not fitted
	 */
	public double noiseFloor = 1.0;

	/**
	 * start value of T2 in ms, s0 starts at the voxel maximum
	 */
	public double initialT2 = 80.0;

	public double[] ub = new double[] { Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY };
	public double[] lb = new double[] { 0.0, 0.0 };
}
