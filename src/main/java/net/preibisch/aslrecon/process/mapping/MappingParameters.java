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

import java.util.Map;

import net.preibisch.aslrecon.Threads;
import net.preibisch.aslrecon.process.fitting.FitSettings;
import net.preibisch.aslrecon.process.fitting.LeastSquaresFitter;
import net.preibisch.aslrecon.process.fitting.LevenbergMarquardtFitter;
import net.preibisch.aslrecon.process.fitting.ProgressListener;

/**
 * Settings shared by all mappings.
 */
public class MappingParameters
{
	/**
	 * number of parallel workers, must be in [1, available processors]
	 */
	public int numWorkers = Threads.numThreads();

	/**
	 * "gaussian", "median" or null
	 */
	public String smoothing = null;

	/**
	 * "sigma" (gaussian) or "size" (median), null for the defaults
	 */
	public Map< String, ? extends Number > smoothingParams = null;

	public int maxIterations = FitSettings.defaultMaxIterations;
	public int maxEvaluations = FitSettings.defaultMaxEvaluations;

	public LeastSquaresFitter fitter = new LevenbergMarquardtFitter();

	/**
	 * null logs progress at debug level
	 */
	public ProgressListener progress = null;

	protected void copyTo( final MappingParameters other )
	{
		other.numWorkers = numWorkers;
		other.smoothing = smoothing;
		other.smoothingParams = smoothingParams;
		other.maxIterations = maxIterations;
		other.maxEvaluations = maxEvaluations;
		other.fitter = fitter;
		other.progress = progress;
	}
}
