package de.codesourcery.m68k.assembler;

/**
 * Operation / index sizes.
 */
public enum Size
{
	BYTE("B","byte",1),
	WORD("W","word",2),
	LONG("L","long word",4);

	public final String shortName;
	public final String readableName;
	public final int sizeInBytes;

	private Size(String shortName,String readableName,int sizeInBytes)
	{
		this.shortName = shortName;
		this.readableName = readableName;
		this.sizeInBytes = sizeInBytes;
	}

	/**
	 * Looks up a size by its one-letter name (case-insensitive).
	 *
	 * @param s
	 * @return size or <code>null</code> if <code>s</code> is neither B, W nor L
	 */
	public static Size fromString(String s)
	{
		if ( s != null )
		{
			switch( s.toUpperCase() )
			{
				case "B": return BYTE;
				case "W": return WORD;
				case "L": return LONG;
				default:
			}
		}
		return null;
	}
}
