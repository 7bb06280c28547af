package de.codesourcery.m68k.assembler;

import java.util.List;

import de.codesourcery.m68k.parser.CompilationError;
import de.codesourcery.m68k.parser.ErrorCollector;
import de.codesourcery.m68k.parser.Parser;
import de.codesourcery.m68k.parser.ast.Program;
import de.codesourcery.m68k.utils.HexDump;
import junit.framework.TestCase;

public class OpcodeTest extends TestCase
{
	private ErrorCollector errors;

	private String assemble(String source)
	{
		errors = new ErrorCollector();
		final Program program = Parser.parse( source , errors );
		assertFalse( "Parsing failed: "+errors , errors.hasErrors() );
		final byte[] data = new Assembler().assemble( program , errors );
		assertFalse( "Assembling failed: "+errors , errors.hasErrors() );
		return HexDump.toWords( data , 0 , data.length );
	}

	private CompilationError assembleWithError(String source)
	{
		errors = new ErrorCollector();
		final Program program = Parser.parse( source , errors );
		assertFalse( "Parsing failed: "+errors , errors.hasErrors() );
		final byte[] data = new Assembler().assemble( program , errors );
		assertEquals( 0 , data.length );
		final List<CompilationError> list = errors.getErrors();
		assertEquals( 1 , list.size() );
		return list.get(0);
	}

	public void testLookup()
	{
		assertSame( Opcode.NOT , Opcode.getOpcode("NOT") );
		assertNull( Opcode.getOpcode("not") );
		assertNull( Opcode.getOpcode("DC") );
	}

	public void testNotDataRegister()
	{
		// 0100 0110 01 000 011
		assertEquals( "4643" , assemble("NOT.W D3") );
		assertEquals( "4643" , assemble("NOT D3") );
	}

	public void testNotSizes()
	{
		assertEquals( "4612" , assemble("NOT.B (A2)") );
		assertEquals( "469a" , assemble("NOT.L (A2)+") );
	}

	public void testNegPredecrement() {
		assertEquals( "4467" , assemble("NEG.W -(SP)") );
	}

	public void testNegx() {
		assertEquals( "4080" , assemble("NEGX.L D0") );
	}

	public void testClrWithDisplacement() {
		assertEquals( "4269 0008" , assemble("CLR.W (8,A1)") );
	}

	public void testClrWithNegativeDisplacement() {
		assertEquals( "4269 fff8" , assemble("CLR.W -8(A1)") );
	}

	public void testTstWithIndex()
	{
		// brief extension word: D/A=0 , D1 , W , 000 , $FE
		assertEquals( "4ab0 10fe" , assemble("TST.L (-2,A0,D1.W)") );
		// A2.L , displacement 4
		assertEquals( "4ab0 a804" , assemble("TST.L (4,A0,A2.L)") );
	}

	public void testAbsoluteWord() {
		assertEquals( "4238 1234" , assemble("CLR.B ($1234).W") );
	}

	public void testAbsoluteLong() {
		assertEquals( "42b9 1234 5678" , assemble("CLR.L ($12345678).L") );
	}

	public void testPea()
	{
		assertEquals( "4850" , assemble("PEA (A0)") );
		assertEquals( "487a 0010" , assemble("PEA (16,PC)") );
		assertEquals( "487b 0802" , assemble("PEA (2,PC,D0.L)") );
	}

	public void testExt()
	{
		assertEquals( "4881" , assemble("EXT.W D1") );
		assertEquals( "48c1" , assemble("EXT.L D1") );
	}

	public void testSwap() {
		assertEquals( "4842" , assemble("SWAP D2") );
	}

	public void testImmediateToDataRegister()
	{
		assertEquals( "0000 0012" , assemble("ORI.B #$12,D0") );
		assertEquals( "0000 00ff" , assemble("ORI.B #-1,D0") );
	}

	public void testImmediateToMemory() {
		assertEquals( "0251 ff00" , assemble("ANDI.W #$FF00,(A1)") );
	}

	public void testLongImmediate() {
		assertEquals( "0a87 1234 5678" , assemble("EORI.L #$12345678,D7") );
	}

	public void testImmediateDataPrecedesDestinationExtension() {
		assertEquals( "0068 0001 0004" , assemble("ORI.W #1,(4,A0)") );
	}

	public void testImmediateToConditionCodeRegister()
	{
		assertEquals( "003c 001f" , assemble("ORI #$1F,CCR") );
		assertEquals( "0a3c 0001" , assemble("EORI.B #1,CCR") );
	}

	public void testImmediateToStatusRegister()
	{
		assertEquals( "027c f8ff" , assemble("ANDI #$F8FF,SR") );
		assertEquals( "007c 2000" , assemble("ORI.W #$2000,SR") );
	}

	public void testDisplacementOutOfRange()
	{
		final CompilationError error = assembleWithError("NOT.W (40000,A0)");
		assertTrue( error.message.contains("40000") );
		assertEquals( 1 , error.location.line );
		assertEquals( 7 , error.location.column );
	}

	public void testIndexDisplacementOutOfRange() {
		assembleWithError("CLR.W (200,A0,D0.W)");
	}

	public void testAbsoluteWordOutOfRange() {
		assembleWithError("CLR.W ($12345).W");
	}

	public void testImmediateOutOfRange()
	{
		assembleWithError("ORI.B #256,D0");
		assembleWithError("ORI.W #$10000,D0");
		assembleWithError("ORI #$100,CCR");
	}

	public void testUnsigned32BitImmediateDoesNotFitSmallerSizes()
	{
		assembleWithError("ORI.W #$FFFFFFFF,D0");
		assembleWithError("ORI.B #4294967295,D0");
	}

	public void testLongImmediateLimits()
	{
		assertEquals( "0080 ffff ffff" , assemble("ORI.L #$FFFFFFFF,D0") );
		assertEquals( "0080 8000 0000" , assemble("ORI.L #-$80000000,D0") );
	}

	public void testUnsigned32BitDisplacementIsOutOfRange()
	{
		final CompilationError error = assembleWithError("CLR.W ($FFFFFFFF,A0)");
		assertTrue( error.message.contains("4294967295") );
	}

	public void testResolveSize()
	{
		assertEquals( Size.LONG , Opcode.NOT.resolveSize( Size.LONG , List.of() ) );
		assertEquals( Size.WORD , Opcode.NOT.resolveSize( null , List.of() ) );
		assertEquals( Size.LONG , Opcode.PEA.resolveSize( null , List.of() ) );
	}
}
