package de.codesourcery.m68k.parser;

public enum TokenType
{
	// single character tokens
	DOT("a dot"),
	COLON("a colon"),
	COMMA("a comma"),
	PARENS_OPEN("an opening parenthesis"),
	PARENS_CLOSE("a closing parenthesis"),
	PLUS("a plus sign"),
	MINUS("a minus sign"),
	HASH("a number sign"),
	// multi-character tokens
	IDENTIFIER("an identifier"),
	NUMBER("a number"),
	COMMENT("a comment");

	public final String description;

	private TokenType(String description) {
		this.description = description;
	}
}
