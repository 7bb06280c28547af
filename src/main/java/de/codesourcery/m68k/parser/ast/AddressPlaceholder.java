package de.codesourcery.m68k.parser.ast;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.parser.Location;

/**
 * Generic address operand.
 *
 * Reserved for directives that take a plain address, the parser never produces it.
 */
public final class AddressPlaceholder extends Operand
{
	public AddressPlaceholder(Location location) {
		super(location);
	}

	@Override
	public OperandType getType() {
		return OperandType.ADDRESS;
	}

	@Override
	public String toString() {
		return "[address operand]";
	}
}
