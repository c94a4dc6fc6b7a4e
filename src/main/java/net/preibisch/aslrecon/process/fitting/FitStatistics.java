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

import java.util.concurrent.atomic.LongAdder;

/**
 * Counts what happened to the voxels of a run, updated concurrently by all workers.
 */
public class FitStatistics
{
	final LongAdder masked = new LongAdder();
	final LongAdder converged = new LongAdder();
	final LongAdder failed = new LongAdder();
	final LongAdder rejected = new LongAdder();

	/**
	 * @return voxels inside the mask
	 */
	public long masked() { return masked.sum(); }

	/**
	 * @return voxels whose fit converged and was accepted
	 */
	public long converged() { return converged.sum(); }

	/**
	 * @return voxels where the solver did not converge
	 */
	public long failed() { return failed.sum(); }

	/**
	 * @return voxels refused before (data-quality check) or after (implausible result) the solver
	 */
	public long rejected() { return rejected.sum(); }

	/**
	 * @return converged / (converged + failed), NaN if the solver never ran
	 */
	public double convergenceRate()
	{
		final long c = converged();
		final long attempts = c + failed();

		return attempts == 0 ? Double.NaN : (double)c / attempts;
	}

	@Override
	public String toString()
	{
		return "masked=" + masked() + ", converged=" + converged() + ", failed=" + failed() + ", rejected=" + rejected() +
				", convergence rate=" + convergenceRate();
	}
}
