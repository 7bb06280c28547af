package de.codesourcery.m68k.utils;

import org.apache.commons.lang.StringUtils;

public class HexDump {

	public static String byteToString(byte b)
	{
		final String byteString = Integer.toString( b & 0xff , 16 );
		return StringUtils.leftPad( byteString , 2 , '0' );
	}

	public static String toAdr(int adr) {
		return StringUtils.leftPad( Integer.toHexString( adr ) , 8 , '0' );
	}

	/**
	 * Renders big-endian 16-bit words, separated by blanks.
	 *
	 * @param data
	 * @param offset
	 * @param len number of bytes
	 * @return
	 */
	public static String toWords(byte[] data,int offset,int len)
	{
		final StringBuilder buffer = new StringBuilder();
		for ( int i = offset ; i < offset + len ; i += 2 )
		{
			if ( buffer.length() > 0 ) {
				buffer.append(" ");
			}
			buffer.append( byteToString( data[i] ) );
			if ( i + 1 < offset + len ) {
				buffer.append( byteToString( data[i+1] ) );
			}
		}
		return buffer.toString();
	}
}
