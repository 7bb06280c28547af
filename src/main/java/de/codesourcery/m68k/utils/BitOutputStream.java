package de.codesourcery.m68k.utils;

import org.apache.commons.lang.StringUtils;

/**
 * Collects bits, most significant bit first.
 *
 * Used to assemble instruction words field by field.
 */
public class BitOutputStream
{
	public static final int WORD_LENGTH = 16;

	private int bitsWritten;
	private byte[] buffer;

	public BitOutputStream() {
		this(2);
	}

	public BitOutputStream(int initialSizeInBytes) {
		buffer = new byte[ Math.max( 1 , initialSizeInBytes ) ];
	}

	public BitOutputStream writeBit(int bit)
	{
		final int offset = bitsWritten >>> 3;
		if ( offset >= buffer.length ) {
			growBuffer();
		}
		if ( bit != 0 ) {
			buffer[ offset ] |= 1<<(7-bitsWritten % 8);
		}
		bitsWritten++;
		return this;
	}

	/**
	 * Writes the lowest <code>bitCount</code> bits of a value, highest bit first.
	 *
	 * @param value
	 * @param bitCount
	 * @return
	 */
	public BitOutputStream writeBits(int value,int bitCount)
	{
		if ( bitCount < 0 || bitCount > 32 ) {
			throw new IllegalArgumentException("bitCount must be in range 0..32 but was "+bitCount);
		}
		for ( int i = bitCount-1 ; i >= 0 ; i-- ) {
			writeBit( (value >>> i) & 1 );
		}
		return this;
	}

	public int getBitsWritten() {
		return bitsWritten;
	}

	/**
	 * Makes sure exactly one 16-bit word has been written.
	 *
	 * @throws IllegalStateException if the bit count is off, the encoding tables are broken then
	 */
	public void assertWordLength() throws IllegalStateException
	{
		if ( bitsWritten != WORD_LENGTH ) {
			throw new IllegalStateException("Internal error, expected "+WORD_LENGTH+" bits but got "+bitsWritten+" ("+toBinaryString()+")");
		}
	}

	/**
	 * Returns the value of the first 16 bits.
	 *
	 * @return
	 */
	public int toWord()
	{
		assertWordLength();
		return ( ( buffer[0] & 0xff ) << 8 ) | ( buffer[1] & 0xff );
	}

	private void growBuffer()
	{
		final byte[] tmp = new byte[buffer.length*2];
		System.arraycopy( buffer , 0 , tmp , 0 , buffer.length );
		buffer = tmp;
	}

	public byte[] toByteArray()
	{
		final int len = (int) Math.ceil( bitsWritten/8f);
		final byte[] result = new byte[ len ];
		System.arraycopy( buffer , 0 , result , 0 , len );
		return result;
	}

	public String toBinaryString()
	{
		final StringBuilder result = new StringBuilder();
		for ( int i = 0 ; i < bitsWritten ; i++ ) {
			result.append( ( buffer[ i >>> 3 ] & (1<<(7-i % 8) ) ) != 0 ? '1' : '0' );
		}
		return StringUtils.isEmpty( result.toString() ) ? "<empty>" : result.toString();
	}

	@Override
	public String toString() {
		return toBinaryString();
	}
}
