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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

public class MRIParametersTest
{
	@Test
	public void testDefaults()
	{
		final MRIParameters p = new MRIParameters();

		assertEquals( 1650, p.t1Blood(), 0 );
		assertEquals( 165, p.t2Blood(), 0 );
		assertEquals( 75, p.t2GreyMatter(), 0 );
		assertEquals( 0.85, p.alpha(), 0 );
		assertEquals( 0.98, p.lambda(), 0 );
		assertEquals( 1400, p.getConstant( "T1csf" ), 0 );
		assertEquals( 1500, p.getConstant( "T2csf" ), 0 );
	}

	@Test
	public void testInstancesAreIndependent()
	{
		final MRIParameters a = new MRIParameters();
		final MRIParameters b = new MRIParameters( a );

		a.setConstant( 1500, "T1bl" );

		assertEquals( 1500, a.t1Blood(), 0 );
		assertEquals( 1650, b.t1Blood(), 0 );
		assertEquals( 1650, new MRIParameters().t1Blood(), 0 );

		b.setAll( a );
		assertEquals( 1500, b.t1Blood(), 0 );
		assertEquals( a, b );
		assertEquals( a.hashCode(), b.hashCode() );
		assertNotEquals( a, new MRIParameters() );
	}

	@Test
	public void testUnknownConstant()
	{
		try
		{
			new MRIParameters().getConstant( "T1gm" );
			fail();
		}
		catch ( final IllegalArgumentException e )
		{
			assertEquals( "Constant type T1gm is not valid. Choose in the list available in the MRIParameter class.", e.getMessage() );
		}

		try
		{
			MRIConstant.fromName( 3 );
			fail();
		}
		catch ( final IllegalArgumentException e )
		{
			// expected, only names are valid
		}
	}

	@Test( expected = IllegalArgumentException.class )
	public void testNonPositiveValue()
	{
		new MRIParameters().setConstant( 0, "Alpha" );
	}
}
