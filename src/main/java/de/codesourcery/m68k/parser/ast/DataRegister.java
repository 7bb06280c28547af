package de.codesourcery.m68k.parser.ast;

public final class DataRegister extends IndexedRegister
{
	public DataRegister(int index) {
		super(index);
	}

	@Override
	public Type getType() {
		return Type.DATA;
	}

	@Override
	protected char prefix() {
		return 'D';
	}
}
