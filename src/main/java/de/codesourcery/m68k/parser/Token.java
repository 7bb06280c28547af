package de.codesourcery.m68k.parser;

import org.apache.commons.lang.Validate;

public final class Token {

	public final TokenType type;
	public final String text;
	public final Location location;

	public Token(TokenType type, String text, Location location)
	{
		Validate.notNull( type , "type must not be NULL");
		Validate.notNull( text , "text must not be NULL");
		Validate.notNull( location , "location must not be NULL");
		this.type = type;
		this.text = text;
		this.location = location;
	}

	public boolean hasType(TokenType t) {
		return t.equals( this.type );
	}

	/**
	 * Returns the value of a {@link TokenType#NUMBER} token.
	 *
	 * Decimal, hexadecimal (<code>$</code> prefix) and binary (<code>%</code> prefix)
	 * notations are supported. Numbers are unsigned, a sign is a separate token.
	 *
	 * @return value in range 0 to <code>$FFFFFFFF</code>
	 * @throws ParseException if this token is no number or its value does not fit into 32 bits
	 */
	public long longValue() throws ParseException
	{
		if ( ! hasType( TokenType.NUMBER ) ) {
			throw new ParseException("Expected a number, but found '"+text+"' instead." , this );
		}
		final long value;
		try
		{
			if ( text.startsWith("$") ) {
				value = Long.parseLong( text.substring(1) , 16 );
			} else if ( text.startsWith("%") ) {
				value = Long.parseLong( text.substring(1) , 2 );
			} else {
				value = Long.parseLong( text );
			}
		}
		catch(NumberFormatException e) {
			throw new ParseException("'"+text+"' is not a valid number." , this );
		}
		if ( value > 0xffffffffL ) {
			throw new ParseException("Number out of range: "+text , this );
		}
		return value;
	}

	@Override
	public String toString() {
		return "Token[ "+type+" , text: >"+text+"< , location: "+location+" ]";
	}

	@Override
	public int hashCode() {
		int result = 31 + type.hashCode();
		result = 31 * result + text.hashCode();
		return 31 * result + location.hashCode();
	}

	@Override
	public boolean equals(Object obj)
	{
		if ( obj instanceof Token)
		{
			final Token other = (Token) obj;
			return type == other.type && text.equals( other.text ) && location.equals( other.location );
		}
		return false;
	}
}
