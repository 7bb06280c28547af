package de.codesourcery.m68k.assembler;

import java.util.List;
import java.util.Optional;

import de.codesourcery.m68k.parser.ErrorCollector;
import de.codesourcery.m68k.parser.Location;
import de.codesourcery.m68k.parser.Parser;
import de.codesourcery.m68k.parser.ast.Program;
import de.codesourcery.m68k.utils.HexDump;
import junit.framework.TestCase;

public class AssemblerTest extends TestCase
{
	private ErrorCollector errors;
	private Assembler assembler;
	private byte[] binary;

	private void assemble(String source) {
		assemble( source , 0 );
	}

	private void assemble(String source,int origin)
	{
		errors = new ErrorCollector();
		final Program program = Parser.parse( source , errors );
		assertFalse( "Parsing failed: "+errors , errors.hasErrors() );
		assembler = new Assembler();
		assembler.setOrigin( origin );
		binary = assembler.assemble( program , errors );
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

	private String words() {
		return HexDump.toWords( binary , 0 , binary.length );
	}

	public void testEmptyProgram()
	{
		assemble("");
		assertEquals( 0 , binary.length );
		assertFalse( errors.hasErrors() );
	}

	public void testCommentsGenerateNoCode()
	{
		assemble("; just a comment\n  SWAP D0 ; another one");
		assertFalse( errors.hasErrors() );
		assertEquals( "4840" , words() );
		assertEquals( 0 , assembler.getAddress(0) );
		assertEquals( 0 , assembler.getAddress(1) );
	}

	public void testBigEndianOutput()
	{
		assemble("NOT.W D3");
		assertEquals( 2 , binary.length );
		assertEquals( 0x46 , binary[0] & 0xff );
		assertEquals( 0x43 , binary[1] & 0xff );
	}

	public void testStatementAddresses()
	{
		assemble("CLR.L ($12345678).L\nNOT D0\nORI.W #1,(4,A0)\nSWAP D1" , 0x1000 );
		assertFalse( errors.hasErrors() );
		assertEquals( 0x1000 , assembler.getOrigin() );
		assertEquals( 0x1000 , assembler.getAddress(0) );
		assertEquals( 0x1006 , assembler.getAddress(1) );
		assertEquals( 0x1008 , assembler.getAddress(2) );
		assertEquals( 0x100e , assembler.getAddress(3) );
		assertEquals( 16 , binary.length );
	}

	public void testOddOriginIsRejected()
	{
		try {
			new Assembler().setOrigin( 0x1001 );
			fail("Should have failed");
		} catch(IllegalArgumentException e) {
			// ok
		}
	}

	public void testSourceMap()
	{
		assemble("; header\nCLR.W (8,A1)\n\nNOT D0" , 0x400 );
		final SourceMap map = assembler.getSourceMap();
		assertEquals( Optional.of(2) , map.getLineNumberForAddress( 0x400 ) );
		assertEquals( Optional.of(2) , map.getLineNumberForAddress( 0x403 ) );
		assertEquals( Optional.of(4) , map.getLineNumberForAddress( 0x404 ) );
		assertEquals( Optional.empty() , map.getLineNumberForAddress( 0x406 ) );
		assertEquals( Optional.empty() , map.getLineNumberForAddress( 0x3fe ) );
	}

	public void testGlobalAndLocalSymbols()
	{
		assemble("main:\n  NOT D0\n.loop:\n  NOT D1\nsub:\n  SWAP D2\n.loop:\n  SWAP D3" , 0x100 );
		assertFalse( "Unexpected errors: "+errors , errors.hasErrors() );

		final SymbolTable table = assembler.getSymbolTable();
		assertEquals( 0x100 , symbol( table , "main" , null ).address );
		assertEquals( 0x102 , symbol( table , ".loop" , "main" ).address );
		assertEquals( 0x104 , symbol( table , "sub" , null ).address );
		assertEquals( 0x106 , symbol( table , ".loop" , "sub" ).address );
		assertEquals( 2 , table.getGlobalSymbols().size() );
		assertEquals( 1 , table.getLocalSymbols("main").size() );
		assertNull( symbol( table , ".loop" , null ) );
	}

	public void testDuplicateGlobalLabel()
	{
		assemble("main:\n  NOT D0\nmain:\n  NOT D1");
		assertEquals( 1 , errors.getErrors().size() );
		assertEquals( new Location(3,1) , errors.getErrors().get(0).location );
		assertEquals( 0 , symbol( assembler.getSymbolTable() , "main" , null ).address );
		assertEquals( 4 , binary.length );
	}

	public void testDuplicateLocalLabel()
	{
		assemble("main:\n.a: NOT D0\n.a: NOT D1");
		assertEquals( 1 , errors.getErrors().size() );
		assertEquals( 3 , errors.getErrors().get(0).location.line );
	}

	public void testLocalLabelWithoutGlobalLabel()
	{
		assemble(".loop: NOT D0");
		assertEquals( 1 , errors.getErrors().size() );
		assertEquals( "Local label .loop without preceding global label" , errors.getErrors().get(0).message );
		assertEquals( 2 , binary.length );
	}

	public void testEncodingErrorSkipsOnlyTheFailingInstruction()
	{
		assemble("NOT D0\nORI.B #300,(8,A0)\nNOT D1");
		assertEquals( 1 , errors.getErrors().size() );
		assertEquals( 2 , errors.getErrors().get(0).location.line );
		assertEquals( "4640 4641" , words() );
		assertEquals( 2 , assembler.getAddress(1) );
		assertEquals( 2 , assembler.getAddress(2) );
	}

	public void testAccessBeforeAssembling()
	{
		try {
			new Assembler().getSymbolTable();
			fail("Should have failed");
		} catch(IllegalStateException e) {
			// ok
		}
	}

	public void testBufferGrows()
	{
		final StringBuilder source = new StringBuilder();
		for ( int i = 0 ; i < 1000 ; i++ ) {
			source.append("CLR.L ($12345678).L\n");
		}
		assemble( source.toString() );
		assertFalse( errors.hasErrors() );
		assertEquals( 6000 , binary.length );
		assertEquals( 0x42 , binary[5994] & 0xff );
		assertEquals( 0x78 , binary[5999] & 0xff );
	}
}
