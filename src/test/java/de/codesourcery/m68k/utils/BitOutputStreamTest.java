package de.codesourcery.m68k.utils;

import junit.framework.TestCase;

public class BitOutputStreamTest extends TestCase {

    public void testWriteLessThanOneByte() {
        final BitOutputStream out = new BitOutputStream(1);
        out.writeBit( 1 );
        out.writeBit( 0 );
        out.writeBit( 1 );
        out.writeBit( 1 );
        out.writeBit( 0 );
        assertEquals( 5 , out.getBitsWritten() );
        final byte[] data = out.toByteArray();
        assertEquals(1,data.length );
        assertEquals( 0b10110000 , data[0] & 0xff );
        assertEquals( "10110" , out.toBinaryString() );
    }

    public void testBufferGrowsBeyondInitialSize()
    {
        final BitOutputStream out = new BitOutputStream(1);
        out.writeBits( 0b10110111 , 8 );
        out.writeBit( 1 );

        assertEquals( 9 , out.getBitsWritten() );
        final byte[] data = out.toByteArray();
        assertEquals(2,data.length );
        assertEquals( 0b10110111 , data[0] & 0xff );
        assertEquals( 0b10000000 , data[1] & 0xff );
    }

    public void testWriteBitsMostSignificantFirst() {
        final BitOutputStream out = new BitOutputStream();
        out.writeBits( 0b0100 , 4 );
        out.writeBits( 0b0110 , 4 );
        out.writeBits( 0b01 , 2 );
        out.writeBits( 0b000 , 3 );
        out.writeBits( 0b011 , 3 );
        assertEquals( 16 , out.getBitsWritten() );
        assertEquals( 0x4643 , out.toWord() );
        assertEquals( "0100011001000011" , out.toBinaryString() );
    }

    public void testOnlyLowestBitsAreWritten() {
        final BitOutputStream out = new BitOutputStream();
        out.writeBits( 0xfff5 , 4 );
        assertEquals( "0101" , out.toBinaryString() );
    }

    public void testAssertWordLength()
    {
        final BitOutputStream out = new BitOutputStream();
        out.writeBits( 0 , 15 );
        try {
            out.assertWordLength();
            fail("Should have failed");
        } catch(IllegalStateException e) {
            assertTrue( e.getMessage().startsWith("Internal error") );
        }
        out.writeBit( 1 );
        out.assertWordLength();
        assertEquals( 1 , out.toWord() );

        out.writeBit( 1 );
        try {
            out.toWord();
            fail("Should have failed");
        } catch(IllegalStateException e) {
            // ok
        }
    }

}
