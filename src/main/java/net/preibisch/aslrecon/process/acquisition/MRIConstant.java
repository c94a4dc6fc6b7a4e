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
package net.preibisch.aslrecon.process.acquisition;

import java.util.HashMap;
import java.util.Map;

/**
 * Physical constants used by the signal models. Relaxation times in ms.
 * <p>
 * Petitclerc L, et al. "Ultra-long-TE arterial spin labeling reveals rapid and brain-wide
 * blood-to-CSF water transport in humans", NeuroImage (2021). DOI: 10.1016/j.neuroimage.2021.118755
 */
public enum MRIConstant
{
	T1bl( 1650.0 ), // T1 of blood
	T1csf( 1400.0 ), // T1 of CSF
	T2bl( 165.0 ), // T2 of blood
	T2gm( 75.0 ), // T2 of grey matter
	T2csf( 1500.0 ), // T2 of CSF
	Alpha( 0.85 ), // labeling efficiency
	Lambda( 0.98 ); // blood-brain partition coefficient

	private static final Map< String, MRIConstant > byName = new HashMap<>();

	static
	{
		for ( final MRIConstant c : values() )
			byName.put( c.name(), c );
	}

	private final double defaultValue;

	private MRIConstant( final double defaultValue )
	{
		this.defaultValue = defaultValue;
	}

	public double defaultValue() { return defaultValue; }

	/**
	 * @param name - exact, case-sensitive name of the constant (e.g. "T1bl")
	 * @return the constant
	 * @throws IllegalArgumentException if there is no constant of that name
	 */
	public static MRIConstant fromName( final Object name )
	{
		final MRIConstant c = name instanceof String ? byName.get( name ) : null;

		if ( c == null )
			throw new IllegalArgumentException(
					"Constant type " + name + " is not valid. Choose in the list available in the MRIParameter class." );

		return c;
	}
}
