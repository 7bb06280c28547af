package de.codesourcery.m68k.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits source text into located tokens.
 *
 * Whitespace and line breaks are dropped, the line structure survives
 * in each token's {@link Location}.
 */
public class Lexer {

	private final Scanner scanner;
	private final IErrorCollector errors;

	private final List<Token> tokens = new ArrayList<>();

	private final StringBuilder buffer = new StringBuilder();

	public Lexer(Scanner scanner,IErrorCollector errors)
	{
		this.scanner = scanner;
		this.errors = errors;
	}

	public static List<Token> tokenize(String source,IErrorCollector errors) {
		return new Lexer( new Scanner( source ) , errors ).tokenize();
	}

	public List<Token> tokenize()
	{
		while ( ! scanner.eof() ) {
			parse();
		}
		return new ArrayList<>( tokens );
	}

	private void parse()
	{
		final char c = scanner.peek();
		if ( Character.isWhitespace( c ) ) {
			scanner.next();
			return;
		}

		final Location location = scanner.currentLocation();
		switch( c )
		{
			case ';':
				parseComment( location );
				return;
			case '.':
				addToken(TokenType.DOT, scanner.next() , location );
				return;
			case ':':
				addToken(TokenType.COLON, scanner.next() , location );
				return;
			case ',':
				addToken(TokenType.COMMA, scanner.next() , location );
				return;
			case '(':
				addToken(TokenType.PARENS_OPEN, scanner.next() , location );
				return;
			case ')':
				addToken(TokenType.PARENS_CLOSE, scanner.next() , location );
				return;
			case '+':
				addToken(TokenType.PLUS, scanner.next() , location );
				return;
			case '-':
				addToken(TokenType.MINUS, scanner.next() , location );
				return;
			case '#':
				addToken(TokenType.HASH, scanner.next() , location );
				return;
			case '$':
			case '%':
				parseNumber( location , scanner.next() );
				return;
			default:
				// $$FALL-THROUGH$$
		}

		if ( Character.isDigit( c ) ) {
			parseNumber( location , null );
		}
		else if ( isIdentifierStart( c ) ) {
			parseIdentifier( location );
		}
		else
		{
			scanner.next();
			errors.add( location , "Unexpected character '"+c+"'." );
		}
	}

	private void parseComment(Location location)
	{
		scanner.next(); // consume ';'
		buffer.setLength( 0 );
		while ( ! scanner.eof() && scanner.peek() != '\n' && scanner.peek() != '\r' ) {
			buffer.append( scanner.next() );
		}
		addToken( TokenType.COMMENT , buffer.toString().trim() , location );
	}

	private void parseNumber(Location location,Character prefix)
	{
		buffer.setLength( 0 );
		if ( prefix != null ) {
			buffer.append( prefix.charValue() );
		}
		// letters are consumed as well so that '12ab' or '$fg' end up as one (invalid) number token
		while ( ! scanner.eof() && Character.isLetterOrDigit( scanner.peek() ) ) {
			buffer.append( scanner.next() );
		}
		addToken( TokenType.NUMBER , buffer.toString() , location );
	}

	private void parseIdentifier(Location location)
	{
		buffer.setLength( 0 );
		while ( ! scanner.eof() && isIdentifierPart( scanner.peek() ) ) {
			buffer.append( scanner.next() );
		}
		addToken( TokenType.IDENTIFIER , buffer.toString() , location );
	}

	private static boolean isIdentifierStart(char c) {
		return c == '_' || ( c >= 'a' && c <= 'z' ) || ( c >= 'A' && c <= 'Z' );
	}

	private static boolean isIdentifierPart(char c) {
		return isIdentifierStart( c ) || ( c >= '0' && c <= '9' );
	}

	private void addToken(TokenType t,char c,Location location) {
		this.tokens.add( new Token(t,Character.toString(c) ,location) );
	}

	private void addToken(TokenType t,String text,Location location) {
		this.tokens.add( new Token(t,text,location) );
	}
}
