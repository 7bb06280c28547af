package de.codesourcery.m68k.assembler;

import de.codesourcery.m68k.utils.BitOutputStream;
import junit.framework.TestCase;

public class SizeEncodingTest extends TestCase
{
	public void testZeroBased()
	{
		assertEquals( 0b00 , SizeEncoding.ZERO_BASED.encode( Size.BYTE ) );
		assertEquals( 0b01 , SizeEncoding.ZERO_BASED.encode( Size.WORD ) );
		assertEquals( 0b10 , SizeEncoding.ZERO_BASED.encode( Size.LONG ) );
	}

	public void testOneBased()
	{
		assertEquals( 0b01 , SizeEncoding.ONE_BASED.encode( Size.BYTE ) );
		assertEquals( 0b10 , SizeEncoding.ONE_BASED.encode( Size.WORD ) );
		assertEquals( 0b11 , SizeEncoding.ONE_BASED.encode( Size.LONG ) );
	}

	public void testSingleBit()
	{
		assertEquals( 0 , SizeEncoding.SINGLE_BIT.encode( Size.WORD ) );
		assertEquals( 1 , SizeEncoding.SINGLE_BIT.encode( Size.LONG ) );
		try {
			SizeEncoding.SINGLE_BIT.encode( Size.BYTE );
			fail("Should have failed");
		} catch(IllegalArgumentException e) {
			// ok
		}
	}

	public void testWriteUsesFieldWidth()
	{
		final BitOutputStream out = new BitOutputStream();
		SizeEncoding.ZERO_BASED.write( Size.BYTE , out );
		SizeEncoding.SINGLE_BIT.write( Size.LONG , out );
		assertEquals( 3 , out.getBitsWritten() );
		assertEquals( "001" , out.toBinaryString() );
	}

	public void testSizeFromString()
	{
		assertEquals( Size.BYTE , Size.fromString("B") );
		assertEquals( Size.WORD , Size.fromString("w") );
		assertNull( Size.fromString("X") );
		assertNull( Size.fromString("WORD") );
	}
}
