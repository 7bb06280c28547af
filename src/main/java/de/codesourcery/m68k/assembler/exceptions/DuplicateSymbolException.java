package de.codesourcery.m68k.assembler.exceptions;

import de.codesourcery.m68k.assembler.Label;
import de.codesourcery.m68k.parser.ParseException;

public class DuplicateSymbolException extends ParseException {

	public final Label symbol;

	public DuplicateSymbolException(Label symbol)
	{
		super("Duplicate symbol "+symbol , symbol.node.location );
		this.symbol = symbol;
	}
}
