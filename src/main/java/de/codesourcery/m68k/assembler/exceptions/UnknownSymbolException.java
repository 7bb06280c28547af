package de.codesourcery.m68k.assembler.exceptions;

import de.codesourcery.m68k.parser.Location;
import de.codesourcery.m68k.parser.ParseException;

public class UnknownSymbolException extends ParseException {

	public final String identifier;
	public final String parentIdentifier;

	public UnknownSymbolException(String identifier,String parentIdentifier,Location location)
	{
		super("Unknown symbol "+( parentIdentifier == null ? identifier : parentIdentifier+identifier ) , location );
		this.identifier = identifier;
		this.parentIdentifier = parentIdentifier;
	}
}
