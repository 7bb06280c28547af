package de.codesourcery.m68k.assembler;

import de.codesourcery.m68k.parser.ast.InstructionNode;
import de.codesourcery.m68k.utils.BitOutputStream;

/**
 * Output side of the assembler, as seen by the instruction encoders.
 */
public interface ICompilationContext
{
	public int getCurrentAddress();

	/**
	 * Writes an instruction word.
	 *
	 * @param bits exactly 16 bits
	 * @throws IllegalStateException if <code>bits</code> is not 16 bits long
	 */
	public void writeWord(BitOutputStream bits) throws IllegalStateException;

	/**
	 * Writes the lowest 16 bits of a value (big-endian).
	 *
	 * @param value
	 */
	public void writeWord(int value);

	/**
	 * Writes a 32-bit value as two words, high word first.
	 *
	 * @param value
	 */
	public void writeLong(int value);

	public void debug(InstructionNode node,String msg);
}
