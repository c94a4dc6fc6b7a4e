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

import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;

/**
 * An ASL acquisition: the M0 reference volume, the labeled-control difference (pcasl)
 * volume and the acquisition timing.
 * <p>
 * Dimensions are in ImgLib2 order. M0 is (x, y, z). The pcasl volume is either
 * (x, y, z, pld) or, for multi-echo data, (x, y, z, pld, te). Either image may be missing
 * (null), the mappings check for what they need.
 */
public class ASLData
{
	public static final int PLD_DIM = 3;
	public static final int TE_DIM = 4;

	private final RandomAccessibleInterval< ? extends RealType< ? > > m0;
	private final RandomAccessibleInterval< ? extends RealType< ? > > pcasl;
	private final AcquisitionDescriptor descriptor;

	public ASLData(
			final RandomAccessibleInterval< ? extends RealType< ? > > pcasl,
			final RandomAccessibleInterval< ? extends RealType< ? > > m0,
			final AcquisitionDescriptor descriptor )
	{
		if ( descriptor == null )
			throw new IllegalArgumentException( "ASLData needs an acquisition descriptor." );

		if ( m0 != null && m0.numDimensions() != 3 )
			throw new IllegalArgumentException( "M0 must be a 3D volume, but has " + m0.numDimensions() + " dimensions." );

		if ( pcasl != null )
		{
			if ( pcasl.numDimensions() != 4 && pcasl.numDimensions() != 5 )
				throw new IllegalArgumentException( "pcasl must be a 4D (x,y,z,pld) or 5D (x,y,z,pld,te) volume, but has " + pcasl.numDimensions() + " dimensions." );

			if ( m0 != null && !Arrays.equals( spatialDimensions( pcasl ), Intervals.dimensionsAsLongArray( m0 ) ) )
				throw new IllegalArgumentException(
						"pcasl spatial dimensions " + Arrays.toString( spatialDimensions( pcasl ) ) +
						" do not match M0 dimensions " + Arrays.toString( Intervals.dimensionsAsLongArray( m0 ) ) );

			if ( descriptor.numDelays() > 0 && pcasl.dimension( PLD_DIM ) != descriptor.numDelays() )
				throw new IllegalArgumentException(
						"pcasl has " + pcasl.dimension( PLD_DIM ) + " delays, but " + descriptor.numDelays() + " PLD values are given." );

			if ( pcasl.numDimensions() == 5 && descriptor.hasTe() && pcasl.dimension( TE_DIM ) != descriptor.numEchoes() )
				throw new IllegalArgumentException(
						"pcasl has " + pcasl.dimension( TE_DIM ) + " echoes, but " + descriptor.numEchoes() + " TE values are given." );
		}

		this.pcasl = pcasl;
		this.m0 = m0;
		this.descriptor = descriptor;
	}

	public RandomAccessibleInterval< ? extends RealType< ? > > getM0() { return m0; }
	public RandomAccessibleInterval< ? extends RealType< ? > > getPcasl() { return pcasl; }
	public AcquisitionDescriptor getDescriptor() { return descriptor; }

	public boolean isMultiEcho() { return pcasl != null && pcasl.numDimensions() == 5; }

	/**
	 * @return the (x, y, z) interval every mask and map of this acquisition has to match
	 */
	public Interval getSpatialInterval()
	{
		if ( m0 != null )
			return m0;

		if ( pcasl != null )
			return Intervals.createMinSize( 0, 0, 0, pcasl.dimension( 0 ), pcasl.dimension( 1 ), pcasl.dimension( 2 ) );

		return null;
	}

	public static long[] spatialDimensions( final Interval interval )
	{
		return new long[] { interval.dimension( 0 ), interval.dimension( 1 ), interval.dimension( 2 ) };
	}
}
