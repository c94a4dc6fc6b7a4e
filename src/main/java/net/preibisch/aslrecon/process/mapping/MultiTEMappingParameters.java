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
 * Parameters of the T1 blood/grey-matter exchange fit (single parameter, in ms).
 */
public class MultiTEMappingParameters extends MappingParameters
{
	public double[] ub = new double[] { Double.POSITIVE_INFINITY };
	public double[] lb = new double[] { 0.0 };
	public double[] par0 = new double[] { 400.0 };

	/**
	 * used when the CBF and ATT maps have to be computed first, its worker count is
	 * overwritten with {@link #numWorkers} and it is never smoothed
	 */
	public CBFMappingParameters cbfParameters = new CBFMappingParameters();

	/**
	 * fitted values are clipped to [0, clipFactor * par0]
	 */
	public double clipFactor = 4.0;
}
