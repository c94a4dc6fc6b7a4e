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

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * The flat parameter buffers of a finished run, one per free parameter, each of size x*y*z
 * and indexed z*(y*x) + y*x + x.
 */
public class VoxelFitResult
{
	private final long[] dimensions;
	private final double[][] buffers;
	private final FitStatistics statistics;

	VoxelFitResult( final long[] dimensions, final double[][] buffers, final FitStatistics statistics )
	{
		this.dimensions = dimensions;
		this.buffers = buffers;
		this.statistics = statistics;
	}

	public int numParameters() { return buffers.length; }
	public long[] dimensions() { return dimensions.clone(); }
	public FitStatistics statistics() { return statistics; }

	/**
	 * @return the raw buffer of one parameter, not a copy
	 */
	public double[] buffer( final int parameter ) { return buffers[ parameter ]; }

	/**
	 * @return the buffer of one parameter wrapped as (x, y, z) image, sharing its memory
	 */
	public ArrayImg< DoubleType, DoubleArray > map( final int parameter )
	{
		return ArrayImgs.doubles( buffers[ parameter ], dimensions );
	}
}
