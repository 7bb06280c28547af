package de.codesourcery.m68k.parser;

/**
 * Character cursor that keeps track of the current line and column.
 */
public final class Scanner {

	private final String input;
	private int index;
	private int line = 1;
	private int column = 1;

	public Scanner(String input) {
		this.input = input;
	}

	public boolean eof() {
		return index >= input.length();
	}

	public Location currentLocation() {
		return new Location(line,column);
	}

	private void assertNotEOF() {
		if ( eof() ) {
			throw new IllegalStateException("Already at EOF");
		}
	}

	public char peek() {
		assertNotEOF();
		return input.charAt(index);
	}

	public char next()
	{
		assertNotEOF();
		final char c = input.charAt(index++);
		if ( c == '\n' ) {
			line++;
			column = 1;
		} else {
			column++;
		}
		return c;
	}
}
