package de.codesourcery.m68k.parser;

import java.util.List;

/**
 * Cursor over the tokens of a single source line.
 *
 * A fresh instance is used for every line.
 */
final class LineParserState
{
	private final List<Token> tokens;
	private final int line;
	private int current;

	public LineParserState(List<Token> tokens,int line)
	{
		this.tokens = tokens;
		this.line = line;
	}

	public int line() {
		return line;
	}

	public boolean isAtEnd() {
		return current >= tokens.size();
	}

	/**
	 * Returns the current token.
	 *
	 * @return token or <code>null</code> if the end of the line has been reached
	 */
	public Token peek() {
		return peek(0);
	}

	public Token peek(int offset)
	{
		final int index = current + offset;
		return index < tokens.size() ? tokens.get( index ) : null;
	}

	public boolean peek(TokenType type)
	{
		final Token token = peek();
		return token != null && token.hasType( type );
	}

	public boolean peek(int offset,TokenType type)
	{
		final Token token = peek(offset);
		return token != null && token.hasType( type );
	}

	public Token next()
	{
		if ( isAtEnd() ) {
			throw new ParseException("Unexpected end of line." , currentLocation() );
		}
		return tokens.get( current++ );
	}

	public boolean consumeIf(TokenType type)
	{
		if ( peek( type ) ) {
			current++;
			return true;
		}
		return false;
	}

	/**
	 * Consumes the current token if it has the expected type, fails otherwise.
	 *
	 * @param type
	 * @param expected description of what was expected, used in the error message
	 * @return
	 * @throws ParseException
	 */
	public Token expect(TokenType type,String expected) throws ParseException
	{
		final Token token = peek();
		if ( token == null ) {
			throw new ParseException("Expected "+expected+", but reached the end of the line." , currentLocation() );
		}
		if ( ! token.hasType( type ) ) {
			throw new ParseException("Expected "+expected+", but found '"+token.text+"' instead." , token );
		}
		current++;
		return token;
	}

	/**
	 * Returns the location of the current token or, when the end of the line has been
	 * reached, the location of the last token.
	 *
	 * @return
	 */
	public Location currentLocation()
	{
		if ( ! isAtEnd() ) {
			return tokens.get( current ).location;
		}
		return tokens.isEmpty() ? new Location(line,1) : tokens.get( tokens.size() - 1 ).location;
	}

	public int position() {
		return current;
	}

	/**
	 * Moves the cursor to the comma that ends the operand starting at <code>operandStart</code>,
	 * ignoring commas inside parentheses. Stops at the end of the line if there is no such comma.
	 *
	 * @param operandStart
	 */
	public void skipToNextOperand(int operandStart)
	{
		current = operandStart;
		int depth = 0;
		while ( ! isAtEnd() )
		{
			final Token token = peek();
			if ( token.hasType( TokenType.COMMENT ) ) {
				return;
			}
			if ( token.hasType( TokenType.PARENS_OPEN ) ) {
				depth++;
			} else if ( token.hasType( TokenType.PARENS_CLOSE ) ) {
				depth = Math.max( 0 , depth - 1 );
			} else if ( token.hasType( TokenType.COMMA ) && depth == 0 ) {
				return;
			}
			current++;
		}
	}

	@Override
	public String toString() {
		return "line "+line+" , token "+current+"/"+tokens.size()+" : "+( isAtEnd() ? "<end of line>" : peek().toString() );
	}
}
