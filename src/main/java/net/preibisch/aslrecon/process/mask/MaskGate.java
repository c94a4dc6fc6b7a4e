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
package net.preibisch.aslrecon.process.mask;

import java.util.Arrays;
import java.util.HashSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Validates a (label) mask against a reference volume and reduces it to the voxels that
 * carry one label.
 */
public class MaskGate
{
	private static final Logger LOG = LoggerFactory.getLogger( MaskGate.class );

	private MaskGate() {}

	/**
	 * @param mask - the label image
	 * @param label - the label of the voxels to process
	 * @param reference - the (x, y, z) interval the mask has to match
	 * @return a new image that is label where mask == label and 0 everywhere else
	 * @throws IllegalArgumentException if the mask is null, the label is not present or the dimensions differ
	 */
	public static ArrayImg< IntType, IntArray > gate(
			final RandomAccessibleInterval< ? extends RealType< ? > > mask,
			final int label,
			final Interval reference )
	{
		if ( mask == null )
			throw new IllegalArgumentException( "mask is not an image. Type null" );

		final HashSet< Double > uniqueValues = new HashSet<>();
		for ( final RealType< ? > t : Views.flatIterable( mask ) )
			uniqueValues.add( t.getRealDouble() );

		// we tolerate label images, everything that is not the label is background
		if ( uniqueValues.size() > 2 )
			LOG.warn( "Mask image is not a binary image ({} distinct values). Only voxels with label {} are processed.", uniqueValues.size(), label );

		if ( !uniqueValues.contains( (double)label ) )
			throw new IllegalArgumentException( "Label value is not found in the mask provided." );

		final long[] maskShape = Intervals.dimensionsAsLongArray( mask );
		final long[] referenceShape = Intervals.dimensionsAsLongArray( reference );

		if ( !Arrays.equals( maskShape, referenceShape ) )
			throw new IllegalArgumentException(
					"Image mask dimension does not match with input 3D volume. Mask shape " +
					Arrays.toString( maskShape ) + " not equal to " + Arrays.toString( referenceShape ) );

		final ArrayImg< IntType, IntArray > binary = ArrayImgs.ints( maskShape );
		final Cursor< ? extends RealType< ? > > in = Views.flatIterable( mask ).cursor();
		final Cursor< IntType > out = binary.cursor();

		while ( out.hasNext() )
			out.next().set( in.next().getRealDouble() == label ? label : 0 );

		return binary;
	}

	/**
	 * @return a mask that processes every voxel of the reference, with label 1
	 */
	public static ArrayImg< IntType, IntArray > all( final Interval reference )
	{
		final ArrayImg< IntType, IntArray > mask = ArrayImgs.ints( Intervals.dimensionsAsLongArray( reference ) );

		for ( final IntType t : mask )
			t.setOne();

		return mask;
	}

	/**
	 * @return number of non-zero voxels
	 */
	public static long countForeground( final RandomAccessibleInterval< ? extends RealType< ? > > mask )
	{
		long count = 0;

		for ( final RealType< ? > t : Views.flatIterable( mask ) )
			if ( t.getRealDouble() != 0 )
				++count;

		return count;
	}
}
