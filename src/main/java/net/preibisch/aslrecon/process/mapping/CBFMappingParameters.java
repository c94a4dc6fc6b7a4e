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
 * Parameters of the CBF/ATT fit. Order of the arrays is (cbf, att), cbf in ml/g/ms and att
 * in ms.
 */
public class CBFMappingParameters extends MappingParameters
{
	public double[] ub = new double[] { 1.0, 5000.0 };
	public double[] lb = new double[] { 0.0, 0.0 };
	public double[] par0 = new double[] { 1e-5, 1000.0 };

	public CBFMappingParameters duplicate()
	{
		final CBFMappingParameters p = new CBFMappingParameters();
		copyTo( p );
		p.ub = ub.clone();
		p.lb = lb.clone();
		p.par0 = par0.clone();
		return p;
	}
}
