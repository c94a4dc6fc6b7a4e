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

import java.util.EnumMap;

/**
 * A mutable set of {@link MRIConstant} values, initialized with the defaults. Every mapping
 * owns its own instance, changing a constant of one mapping never affects another one.
 */
public class MRIParameters
{
	private final EnumMap< MRIConstant, Double > values = new EnumMap<>( MRIConstant.class );

	public MRIParameters()
	{
		for ( final MRIConstant c : MRIConstant.values() )
			values.put( c, c.defaultValue() );
	}

	public MRIParameters( final MRIParameters other )
	{
		values.putAll( other.values );
	}

	/**
	 * Overwrites all values with the ones of other.
	 */
	public void setAll( final MRIParameters other )
	{
		values.putAll( other.values );
	}

	public double get( final MRIConstant constant ) { return values.get( constant ); }

	public void set( final MRIConstant constant, final double value )
	{
		if ( Double.isNaN( value ) || value <= 0 )
			throw new IllegalArgumentException( "Constant " + constant + " must be a positive number, but was " + value );

		values.put( constant, value );
	}

	public double getConstant( final String name ) { return get( MRIConstant.fromName( name ) ); }
	public void setConstant( final double value, final String name ) { set( MRIConstant.fromName( name ), value ); }

	public double t1Blood() { return get( MRIConstant.T1bl ); }
	public double t2Blood() { return get( MRIConstant.T2bl ); }
	public double t2GreyMatter() { return get( MRIConstant.T2gm ); }
	public double alpha() { return get( MRIConstant.Alpha ); }
	public double lambda() { return get( MRIConstant.Lambda ); }

	@Override
	public boolean equals( final Object o )
	{
		return o instanceof MRIParameters && values.equals( ( (MRIParameters)o ).values );
	}

	@Override
	public int hashCode()
	{
		return values.hashCode();
	}

	@Override
	public String toString()
	{
		return values.toString();
	}
}
