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
package net.preibisch.aslrecon.process.models;

/**
 * s(TE) = s0 * exp(-TE / T2)
 */
public class MonoExponentialModel
{
	public static double[] predict( final double[] te, final double s0, final double t2 )
	{
		if ( te == null )
			throw new IllegalArgumentException( "te parameter must be an array of values." );

		final double[] signal = new double[ te.length ];

		for ( int e = 0; e < te.length; ++e )
			signal[ e ] = BuxtonModel.finiteOrZero( s0 * Math.exp( -te[ e ] / t2 ) );

		return signal;
	}
}
