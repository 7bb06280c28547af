package de.codesourcery.m68k.assembler;

import de.codesourcery.m68k.utils.BitOutputStream;

/**
 * The ways instruction families encode the operation size.
 */
public enum SizeEncoding
{
	/**
	 * byte = 00 , word = 01 , long = 10
	 */
	ZERO_BASED(2)
	{
		@Override
		public int encode(Size size)
		{
			switch( size ) {
				case BYTE: return 0b00;
				case WORD: return 0b01;
				case LONG: return 0b10;
				default:
					throw new RuntimeException("Unhandled size: "+size);
			}
		}
	},
	/**
	 * byte = 01 , word = 10 , long = 11
	 */
	ONE_BASED(2)
	{
		@Override
		public int encode(Size size)
		{
			switch( size ) {
				case BYTE: return 0b01;
				case WORD: return 0b10;
				case LONG: return 0b11;
				default:
					throw new RuntimeException("Unhandled size: "+size);
			}
		}
	},
	/**
	 * word = 0 , long = 1 , byte is not encodable.
	 */
	SINGLE_BIT(1)
	{
		@Override
		public int encode(Size size)
		{
			switch( size ) {
				case WORD: return 0;
				case LONG: return 1;
				case BYTE:
					throw new IllegalArgumentException("Internal error, byte size cannot be encoded as a single bit");
				default:
					throw new RuntimeException("Unhandled size: "+size);
			}
		}
	};

	public final int bitCount;

	private SizeEncoding(int bitCount) {
		this.bitCount = bitCount;
	}

	public abstract int encode(Size size);

	public void write(Size size,BitOutputStream out) {
		out.writeBits( encode( size ) , bitCount );
	}
}
