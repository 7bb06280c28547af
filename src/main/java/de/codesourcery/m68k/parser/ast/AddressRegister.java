package de.codesourcery.m68k.parser.ast;

public final class AddressRegister extends IndexedRegister
{
	public AddressRegister(int index) {
		super(index);
	}

	@Override
	public Type getType() {
		return Type.ADDRESS;
	}

	@Override
	protected char prefix() {
		return 'A';
	}
}
