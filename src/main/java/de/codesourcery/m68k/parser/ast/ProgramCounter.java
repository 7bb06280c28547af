package de.codesourcery.m68k.parser.ast;

public final class ProgramCounter extends Register
{
	public static final ProgramCounter INSTANCE = new ProgramCounter();

	private ProgramCounter() {
	}

	@Override
	public Type getType() {
		return Type.PC;
	}

	@Override
	public String toString() {
		return "PC";
	}
}
