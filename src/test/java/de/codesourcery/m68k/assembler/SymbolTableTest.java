package de.codesourcery.m68k.assembler;

import java.util.List;

import de.codesourcery.m68k.assembler.exceptions.DuplicateSymbolException;
import de.codesourcery.m68k.assembler.exceptions.UnknownSymbolException;
import de.codesourcery.m68k.parser.Location;
import de.codesourcery.m68k.parser.ast.LabelNode;
import junit.framework.TestCase;

public class SymbolTableTest extends TestCase
{
	private SymbolTable table;

	@Override
	protected void setUp() throws Exception {
		table = new SymbolTable();
	}

	private static Label symbol(SymbolTable table,String name,String parentName)
	{
		final List<Label> candidates = parentName == null ? table.getGlobalSymbols() : table.getLocalSymbols( parentName );
		for ( Label label : candidates ) {
			if ( label.name.equals( name ) ) {
				return label;
			}
		}
		return null;
	}

	private static Label global(String name,int address) {
		return new Label( new LabelNode( new Location(1,1) , name ) , null , address );
	}

	private static Label local(String name,String parent,int address) {
		return new Label( new LabelNode( new Location(2,1) , name ) , parent , address );
	}

	public void testDefineAndLookup()
	{
		table.defineSymbol( global("main",0x10) );
		table.defineSymbol( local(".loop","main",0x12) );
		assertEquals( 0x10 , symbol( table , "main" , null ).address );
		assertEquals( 0x12 , symbol( table , ".loop" , "main" ).address );
		assertNull( symbol( table , ".loop" , "other" ) );
		assertEquals( 1 , table.getLocalSymbols("main").size() );
		assertTrue( table.getLocalSymbols("other").isEmpty() );
	}

	public void testLocalLabelsAreScopedToTheirParent()
	{
		table.defineSymbol( global("a",0) );
		table.defineSymbol( global("b",2) );
		table.defineSymbol( local(".x","a",0) );
		table.defineSymbol( local(".x","b",2) );
		assertEquals( 0 , symbol( table , ".x" , "a" ).address );
		assertEquals( 2 , symbol( table , ".x" , "b" ).address );
	}

	public void testDuplicateGlobal()
	{
		table.defineSymbol( global("main",0) );
		try {
			table.defineSymbol( global("main",2) );
			fail("Should have failed");
		} catch(DuplicateSymbolException e) {
			assertEquals( 2 , e.symbol.address );
			assertEquals( new Location(1,1) , e.location );
		}
	}

	public void testLocalWithoutParent()
	{
		try {
			table.defineSymbol( local(".x","missing",0) );
			fail("Should have failed");
		} catch(UnknownSymbolException e) {
			assertEquals( "missing" , e.identifier );
		}
	}

	public void testLocalLabelNeedsParentName()
	{
		try {
			new Label( new LabelNode( new Location(1,1) , ".x" ) , null , 0 );
			fail("Should have failed");
		} catch(IllegalArgumentException e) {
			// ok
		}
	}
}
