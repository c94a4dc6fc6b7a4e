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

import java.util.Arrays;

/**
 * Timing of an ASL acquisition: labeling durations (LD), post-labeling delays (PLD),
 * optional echo times (TE) and optional diffusion weightings (DW). LD, PLD and TE are
 * in milliseconds.
 * <p>
 * LD and PLD always have the same size, every value is a finite number &gt; 0. Every
 * setter re-validates, so an instance can never be observed in an inconsistent state.
 */
public class AcquisitionDescriptor
{
	private double[] ld, pld, te, dw;

	public AcquisitionDescriptor( final double[] ld, final double[] pld )
	{
		this( ld, pld, null, null );
	}

	public AcquisitionDescriptor( final double[] ld, final double[] pld, final double[] te )
	{
		this( ld, pld, te, null );
	}

	/**
	 * @param ld - labeling durations, may be empty but not null
	 * @param pld - post-labeling delays, same size as ld
	 * @param te - echo times or null
	 * @param dw - diffusion weightings or null
	 */
	public AcquisitionDescriptor( final double[] ld, final double[] pld, final double[] te, final double[] dw )
	{
		setLdPld( ld, pld );
		setTe( te );
		setDw( dw );
	}

	public double[] getLd() { return ld.clone(); }
	public double[] getPld() { return pld.clone(); }

	/**
	 * @return the echo times or null if this is not a multi-echo acquisition
	 */
	public double[] getTe() { return te == null ? null : te.clone(); }

	/**
	 * @return the diffusion weightings or null if this is not a diffusion-weighted acquisition
	 */
	public double[] getDw() { return dw == null ? null : dw.clone(); }

	public int numDelays() { return pld.length; }
	public int numEchoes() { return te == null ? 0 : te.length; }

	public boolean hasTe() { return te != null; }
	public boolean hasDw() { return dw != null; }

	public void setLd( final double[] ld )
	{
		checkValues( ld, "LD" );
		checkSizes( ld, pld );
		this.ld = ld.clone();
	}

	public void setPld( final double[] pld )
	{
		checkValues( pld, "PLD" );
		checkSizes( ld, pld );
		this.pld = pld.clone();
	}

	/**
	 * Replaces both LD and PLD, needed whenever the number of conditions changes.
	 */
	public void setLdPld( final double[] ld, final double[] pld )
	{
		checkValues( ld, "LD" );
		checkValues( pld, "PLD" );
		checkSizes( ld, pld );
		this.ld = ld.clone();
		this.pld = pld.clone();
	}

	public void setTe( final double[] te )
	{
		if ( te != null )
			checkValues( te, "TE" );

		this.te = te == null ? null : te.clone();
	}

	public void setDw( final double[] dw )
	{
		if ( dw != null )
			checkValues( dw, "DW" );

		this.dw = dw == null ? null : dw.clone();
	}

	protected static void checkSizes( final double[] ld, final double[] pld )
	{
		if ( ld != null && pld != null && ld.length != pld.length )
			throw new IllegalArgumentException(
					"LD and PLD must have the same array size. LD size is " + ld.length + " and PLD size is " + pld.length );
	}

	protected static void checkValues( final double[] values, final String type )
	{
		if ( values == null )
			throw new IllegalArgumentException( type + " values is not a list of valid numbers." );

		for ( final double v : values )
		{
			if ( Double.isNaN( v ) || Double.isInfinite( v ) )
				throw new IllegalArgumentException( type + " values is not a list of valid numbers." );

			if ( v <= 0 )
				throw new IllegalArgumentException( type + " values must be postive non zero numbers." );
		}
	}

	@Override
	public String toString()
	{
		return "LD=" + Arrays.toString( ld ) + ", PLD=" + Arrays.toString( pld ) +
				", TE=" + Arrays.toString( te ) + ", DW=" + Arrays.toString( dw );
	}
}
