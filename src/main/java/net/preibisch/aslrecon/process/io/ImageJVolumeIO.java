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
package net.preibisch.aslrecon.process.io;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.process.FloatProcessor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * {@link VolumeIO} for ImageJ 1.x TIFF (hyper)stacks: width, height and slices are x, y and z,
 * channels are the delays (pld) and frames the echo times (te).
 */
public class ImageJVolumeIO implements VolumeIO
{
	private static final Logger LOG = LoggerFactory.getLogger( ImageJVolumeIO.class );

	@Override
	public RandomAccessibleInterval< FloatType > load( final String path ) throws IOException
	{
		if ( path == null || !new File( path ).isFile() )
			throw new IOException( "Invalid image type or path: " + path );

		final ImagePlus imp = IJ.openImage( path );

		if ( imp == null )
			throw new IOException( "Invalid image type or path: " + path );

		final int w = imp.getWidth(), h = imp.getHeight();
		final int nz = imp.getNSlices(), nc = imp.getNChannels(), nt = imp.getNFrames();

		final long[] dim;
		if ( nt > 1 )
			dim = new long[] { w, h, nz, nc, nt };
		else if ( nc > 1 )
			dim = new long[] { w, h, nz, nc };
		else
			dim = new long[] { w, h, nz };

		final ArrayImg< FloatType, FloatArray > img = ArrayImgs.floats( dim );
		final float[] data = img.update( null ).getCurrentStorageArray();
		final ImageStack stack = imp.getStack();
		final int planeSize = w * h;

		for ( int t = 0; t < nt; ++t )
			for ( int c = 0; c < nc; ++c )
				for ( int z = 0; z < nz; ++z )
				{
					final float[] plane = (float[])stack.getProcessor( imp.getStackIndex( c + 1, z + 1, t + 1 ) ).convertToFloatProcessor().getPixels();
					System.arraycopy( plane, 0, data, ( z + nz * ( c + nc * t ) ) * planeSize, planeSize );
				}

		LOG.debug( "Loaded '{}' as {}", path, Arrays.toString( dim ) );

		return img;
	}

	@Override
	public void save( final RandomAccessibleInterval< ? extends RealType< ? > > img, final String path ) throws IOException
	{
		final int n = img.numDimensions();

		if ( n < 3 || n > 5 )
			throw new IOException( "Only (x,y,z[,pld[,te]]) volumes can be saved, image has " + n + " dimensions." );

		final int w = (int)img.dimension( 0 ), h = (int)img.dimension( 1 ), nz = (int)img.dimension( 2 );
		final int nc = n > 3 ? (int)img.dimension( 3 ) : 1;
		final int nt = n > 4 ? (int)img.dimension( 4 ) : 1;
		final int planeSize = w * h;

		final float[] data = new float[ (int)Intervals.numElements( img ) ];
		int i = 0;
		for ( final RealType< ? > t : Views.flatIterable( Views.zeroMin( img ) ) )
			data[ i++ ] = t.getRealFloat();

		final ImageStack stack = new ImageStack( w, h );

		// ImageJ hyperstack order: channel fastest, then slice, then frame
		for ( int t = 0; t < nt; ++t )
			for ( int z = 0; z < nz; ++z )
				for ( int c = 0; c < nc; ++c )
				{
					final float[] plane = new float[ planeSize ];
					System.arraycopy( data, ( z + nz * ( c + nc * t ) ) * planeSize, plane, 0, planeSize );
					stack.addSlice( new FloatProcessor( w, h, plane ) );
				}

		final ImagePlus imp = new ImagePlus( new File( path ).getName(), stack );
		imp.setDimensions( nc, nz, nt );
		imp.setOpenAsHyperStack( nc > 1 || nt > 1 );

		final FileSaver saver = new FileSaver( imp );
		final boolean saved = stack.getSize() > 1 ? saver.saveAsTiffStack( path ) : saver.saveAsTiff( path );

		if ( !saved )
			throw new IOException( "Could not save image to: " + path );

		LOG.debug( "Saved '{}'", path );
	}
}
