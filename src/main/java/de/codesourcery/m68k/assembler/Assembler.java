package de.codesourcery.m68k.assembler;

import java.util.Arrays;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.Constants;
import de.codesourcery.m68k.parser.IErrorCollector;
import de.codesourcery.m68k.parser.ParseException;
import de.codesourcery.m68k.parser.ast.InstructionNode;
import de.codesourcery.m68k.parser.ast.LabelNode;
import de.codesourcery.m68k.parser.ast.Program;
import de.codesourcery.m68k.parser.ast.Statement;
import de.codesourcery.m68k.utils.BitOutputStream;
import de.codesourcery.m68k.utils.HexDump;

/**
 * Turns a parsed {@link Program} into big-endian 68000 machine code.
 *
 * Labels are only ever defined, never referenced by instructions, so a single pass is sufficient.
 */
public class Assembler
{
	protected static final boolean DEBUG_ENABLED = Constants.ASSEMBLER_DEBUG;

	private boolean debug = DEBUG_ENABLED;
	private int origin = Constants.DEFAULT_ORIGIN;

	protected DefaultContext context;

	protected final class DefaultContext implements ICompilationContext
	{
		protected byte[] buffer = new byte[ Constants.ASSEMBLER_INITIAL_BUFFER_SIZE ];
		protected int currentWriteOffset;
		protected int currentAddress;

		private final SourceMap sourceMap = new SourceMap();
		private final SymbolTable symbolTable = new SymbolTable();
		private int[] addresses = new int[0];

		public DefaultContext(int origin)
		{
			this.currentAddress = origin;
		}

		@Override
		public void writeWord(BitOutputStream bits) throws IllegalStateException
		{
			bits.assertWordLength();
			writeWord( bits.toWord() );
		}

		@Override
		public void writeWord(int value)
		{
			if ( currentWriteOffset + 2 > buffer.length ) {
				expandBuffer();
			}
			// 68000 is big-endian => high byte first
			buffer[currentWriteOffset++] = (byte) ((value & 0xff00) >> 8);
			buffer[currentWriteOffset++] = (byte) (value & 0xff);
			currentAddress += 2;
		}

		@Override
		public void writeLong(int value)
		{
			writeWord( value >>> 16 );
			writeWord( value & 0xffff );
		}

		@Override
		public void debug(InstructionNode node, String msg)
		{
			if ( debug ) {
				System.out.println( HexDump.toAdr( currentAddress )+" : "+node+" : "+msg);
			}
		}

		@Override
		public int getCurrentAddress() {
			return currentAddress;
		}

		public void assemble(Program program,IErrorCollector errors)
		{
			addresses = new int[ program.getStatementCount() ];
			String currentGlobalLabel = null;

			for ( int i = 0 ; i < program.getStatementCount() ; i++ )
			{
				addresses[i] = currentAddress;

				for ( LabelNode label : program.getLabelsAt( i ) )
				{
					if ( label.isGlobal() ) {
						currentGlobalLabel = label.name;
					}
					else if ( currentGlobalLabel == null )
					{
						errors.add( label.location , "Local label "+label.name+" without preceding global label");
						continue;
					}
					try {
						symbolTable.defineSymbol( new Label( label , label.isGlobal() ? null : currentGlobalLabel , currentAddress ) );
					} catch(ParseException e) {
						errors.add( e );
					}
				}

				final Statement statement = program.statement( i );
				if ( statement.hasType( Statement.Type.INSTRUCTION ) ) {
					assemble( (InstructionNode) statement , errors );
				}
			}
		}

		private void assemble(InstructionNode ins,IErrorCollector errors)
		{
			final int startAddress = currentAddress;
			final int startOffset = currentWriteOffset;
			try
			{
				ins.opcode.assemble( ins , this );
			}
			catch(ParseException e)
			{
				currentAddress = startAddress;
				currentWriteOffset = startOffset;
				errors.add( e.hasLocation() ? e : new ParseException( e.getMessage() , ins.location ) );
				return;
			}
			if ( currentAddress != startAddress )
			{
				sourceMap.addAddressRange( startAddress , currentAddress - startAddress , ins.location.line );
				debug( ins , "Generated "+HexDump.toWords( buffer , startOffset , currentWriteOffset - startOffset ) );
			}
		}

		private void expandBuffer() {
			final byte[] newBuffer = new byte[buffer.length*2];
			System.arraycopy( buffer, 0 , newBuffer , 0 , buffer.length );
			buffer = newBuffer;
		}

		public byte[] getBytes() {
			return Arrays.copyOf( buffer , currentWriteOffset );
		}
	}

	public void setDebug(boolean debug) {
		this.debug = debug;
	}

	/**
	 * Sets the address the generated code is going to be loaded at.
	 *
	 * @param origin must be even, 68000 instructions are word-aligned
	 */
	public void setOrigin(int origin)
	{
		Validate.isTrue( (origin & 1) == 0 , "Origin must be word-aligned");
		this.origin = origin;
	}

	/**
	 * Returns the intended output / starting address of the generated binary.
	 * @return
	 */
	public int getOrigin()
	{
		return origin;
	}

	/**
	 * Assembles a program.
	 *
	 * Encoding failures of individual instructions are reported to the error collector,
	 * the offending instruction generates no code and assembly continues with the next statement.
	 *
	 * @param program
	 * @param errors
	 * @return generated code, starting at the origin
	 */
	public byte[] assemble(Program program,IErrorCollector errors)
	{
		Validate.notNull( program , "program must not be NULL");
		Validate.notNull( errors , "errors must not be NULL");

		context = new DefaultContext( origin );
		context.assemble( program , errors );
		return context.getBytes();
	}

	/**
	 * Returns the address a statement was assembled to.
	 *
	 * @param statementIndex
	 * @return
	 */
	public int getAddress(int statementIndex)
	{
		assertAssembled();
		return context.addresses[ statementIndex ];
	}

	public SourceMap getSourceMap() {
		assertAssembled();
		return context.sourceMap;
	}

	public SymbolTable getSymbolTable() {
		assertAssembled();
		return context.symbolTable;
	}

	private void assertAssembled()
	{
		if ( context == null ) {
			throw new IllegalStateException("assemble() has not been called yet");
		}
	}
}
