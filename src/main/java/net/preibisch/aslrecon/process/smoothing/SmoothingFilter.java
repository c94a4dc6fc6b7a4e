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
package net.preibisch.aslrecon.process.smoothing;

import java.util.HashMap;
import java.util.Map;

/**
 * The filters that can be applied to output maps.
 */
public enum SmoothingFilter
{
	GAUSSIAN( "gaussian" ), MEDIAN( "median" );

	private static final Map< String, SmoothingFilter > byName = new HashMap<>();

	static
	{
		for ( final SmoothingFilter f : values() )
			byName.put( f.name, f );
	}

	private final String name;

	private SmoothingFilter( final String name )
	{
		this.name = name;
	}

	@Override
	public String toString() { return name; }

	/**
	 * @param name - "gaussian" or "median"
	 * @return the filter, null if name is null
	 * @throws IllegalArgumentException for every other name
	 */
	public static SmoothingFilter fromName( final String name )
	{
		if ( name == null )
			return null;

		final SmoothingFilter filter = byName.get( name );

		if ( filter == null )
			throw new IllegalArgumentException( "Unsupported smoothing type: " + name + ". Choose from " + byName.keySet() );

		return filter;
	}
}
