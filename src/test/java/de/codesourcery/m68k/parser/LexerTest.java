package de.codesourcery.m68k.parser;

import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;

public class LexerTest extends TestCase {

	private ErrorCollector errors;
	private List<Token> tokens;

	private void lex(String s) {
		errors = new ErrorCollector();
		tokens = Lexer.tokenize( s , errors );
	}

	private List<TokenType> types() {
		final List<TokenType> result = new ArrayList<>();
		for ( Token t : tokens ) {
			result.add( t.type );
		}
		return result;
	}

	public void testEmptySource() {
		lex("");
		assertTrue( tokens.isEmpty() );
		assertFalse( errors.hasErrors() );
	}

	public void testWhitespaceOnly() {
		lex("  \t \n   \n");
		assertTrue( tokens.isEmpty() );
	}

	public void testInstructionWithSize()
	{
		lex("NOT.W D3");
		assertEquals( List.of( TokenType.IDENTIFIER , TokenType.DOT , TokenType.IDENTIFIER , TokenType.IDENTIFIER ) , types() );
		assertEquals( "NOT" , tokens.get(0).text );
		assertEquals( "W" , tokens.get(2).text );
		assertEquals( "D3" , tokens.get(3).text );
		assertEquals( new Location(1,1) , tokens.get(0).location );
		assertEquals( new Location(1,4) , tokens.get(1).location );
		assertEquals( new Location(1,7) , tokens.get(3).location );
	}

	public void testPunctuation()
	{
		lex("-(A3)+,#:");
		assertEquals( List.of( TokenType.MINUS , TokenType.PARENS_OPEN , TokenType.IDENTIFIER , TokenType.PARENS_CLOSE ,
				TokenType.PLUS , TokenType.COMMA , TokenType.HASH , TokenType.COLON ) , types() );
	}

	public void testComment()
	{
		lex("  CLR D0   ;  clear it  ");
		assertEquals( TokenType.COMMENT , tokens.get( tokens.size()-1 ).type );
		assertEquals( "clear it" , tokens.get( tokens.size()-1 ).text );
		assertEquals( new Location(1,12) , tokens.get( tokens.size()-1 ).location );
	}

	public void testCommentEndsAtLineBreak()
	{
		lex("; first\nSWAP D1");
		assertEquals( List.of( TokenType.COMMENT , TokenType.IDENTIFIER , TokenType.IDENTIFIER ) , types() );
		assertEquals( "first" , tokens.get(0).text );
		assertEquals( new Location(2,1) , tokens.get(1).location );
		assertEquals( new Location(2,6) , tokens.get(2).location );
	}

	public void testNumbers()
	{
		lex("12 $7F %1010");
		assertEquals( List.of( TokenType.NUMBER , TokenType.NUMBER , TokenType.NUMBER ) , types() );
		assertEquals( 12 , tokens.get(0).longValue() );
		assertEquals( 0x7f , tokens.get(1).longValue() );
		assertEquals( 10 , tokens.get(2).longValue() );
	}

	public void testLargestUnsigned32BitNumber() {
		lex("$FFFFFFFF");
		assertEquals( 0xffffffffL , tokens.get(0).longValue() );
	}

	public void testNumberTooLarge()
	{
		lex("$100000000");
		try {
			tokens.get(0).longValue();
			fail("Should have failed");
		} catch(ParseException e) {
			assertEquals( new Location(1,1) , e.location );
		}
	}

	public void testMalformedNumberIsOneToken()
	{
		lex("12ab");
		assertEquals( 1 , tokens.size() );
		assertEquals( TokenType.NUMBER , tokens.get(0).type );
		try {
			tokens.get(0).longValue();
			fail("Should have failed");
		} catch(ParseException e) {
			// ok
		}
	}

	public void testIdentifierWithUnderscoreAndDigits()
	{
		lex("_loop_2:");
		assertEquals( List.of( TokenType.IDENTIFIER , TokenType.COLON ) , types() );
		assertEquals( "_loop_2" , tokens.get(0).text );
	}

	public void testUnexpectedCharacterIsReportedAndSkipped()
	{
		lex("NOT @D0");
		assertEquals( List.of( TokenType.IDENTIFIER , TokenType.IDENTIFIER ) , types() );
		assertTrue( errors.hasErrors() );
		assertEquals( 1 , errors.getErrors().size() );
		assertEquals( new Location(1,5) , errors.getErrors().get(0).location );
	}
}
