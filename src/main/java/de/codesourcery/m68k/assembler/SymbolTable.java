package de.codesourcery.m68k.assembler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import de.codesourcery.m68k.assembler.exceptions.DuplicateSymbolException;
import de.codesourcery.m68k.assembler.exceptions.UnknownSymbolException;

/**
 * Global labels and the local labels scoped to them.
 */
public class SymbolTable {

	private final Map<String,Label> globalSymbols = new HashMap<>();
	private final Map<String,Map<String,Label>> localSymbols = new HashMap<>();

	public List<Label> getGlobalSymbols()
	{
		return new ArrayList<>( globalSymbols.values() );
	}

	public List<Label> getLocalSymbols(String globalSymbol)
	{
		final Map<String,Label> map = localSymbols.get( globalSymbol );
		if ( map == null ) {
			return new ArrayList<>();
		}
		return new ArrayList<>( map.values() );
	}

	public void defineSymbol(Label label) throws DuplicateSymbolException
	{
		if ( label.isGlobal() )
		{
			if ( globalSymbols.containsKey( label.name ) ) {
				throw new DuplicateSymbolException( label );
			}
			globalSymbols.put( label.name , label );
			return;
		}

		// local symbol
		if ( ! globalSymbols.containsKey( label.parentName ) ) {
			throw new UnknownSymbolException( label.parentName , null , label.node.location );
		}
		Map<String,Label> syms = localSymbols.get( label.parentName );
		if ( syms == null ) {
			syms = new HashMap<>();
			localSymbols.put( label.parentName , syms );
		}
		if ( syms.containsKey( label.name ) ) {
			throw new DuplicateSymbolException( label );
		}
		syms.put( label.name , label );
	}
}
