package de.codesourcery.m68k.assembler;

import static de.codesourcery.m68k.assembler.OperandType.CONDITION_CODE_REGISTER;
import static de.codesourcery.m68k.assembler.OperandType.DATA_REGISTER_DIRECT;
import static de.codesourcery.m68k.assembler.OperandType.IMMEDIATE;
import static de.codesourcery.m68k.assembler.OperandType.STATUS_REGISTER;
import static de.codesourcery.m68k.assembler.Size.BYTE;
import static de.codesourcery.m68k.assembler.Size.LONG;
import static de.codesourcery.m68k.assembler.Size.WORD;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import de.codesourcery.m68k.parser.ast.Immediate;
import de.codesourcery.m68k.parser.ast.InstructionNode;
import de.codesourcery.m68k.parser.ast.Operand;
import de.codesourcery.m68k.utils.BitOutputStream;

/**
 * The instructions the assembler knows about.
 *
 * Each opcode lists the size / operand combinations the CPU accepts
 * and knows how to encode itself.
 */
public enum Opcode
{
	/*
	 * 0100 0110 ss eeeeee
	 */
	NOT("NOT",WORD,new Configuration( sizes(BYTE,WORD,LONG) , OperandType.DATA_ALTERABLE ) )
	{
		@Override public void assemble(InstructionNode ins, ICompilationContext context) { assembleSingleOperand( ins , context , 0b01000110 ); }
	},
	/*
	 * 0100 0100 ss eeeeee
	 */
	NEG("NEG",WORD,new Configuration( sizes(BYTE,WORD,LONG) , OperandType.DATA_ALTERABLE ) )
	{
		@Override public void assemble(InstructionNode ins, ICompilationContext context) { assembleSingleOperand( ins , context , 0b01000100 ); }
	},
	NEGX("NEGX",WORD,new Configuration( sizes(BYTE,WORD,LONG) , OperandType.DATA_ALTERABLE ) )
	{
		@Override public void assemble(InstructionNode ins, ICompilationContext context) { assembleSingleOperand( ins , context , 0b01000000 ); }
	},
	CLR("CLR",WORD,new Configuration( sizes(BYTE,WORD,LONG) , OperandType.DATA_ALTERABLE ) )
	{
		@Override public void assemble(InstructionNode ins, ICompilationContext context) { assembleSingleOperand( ins , context , 0b01000010 ); }
	},
	TST("TST",WORD,new Configuration( sizes(BYTE,WORD,LONG) , OperandType.DATA_ALTERABLE ) )
	{
		@Override public void assemble(InstructionNode ins, ICompilationContext context) { assembleSingleOperand( ins , context , 0b01001010 ); }
	},
	/*
	 * EXT.W Dn       0100 1000 1000 0rrr
	 * EXT.L Dn       0100 1000 1100 0rrr
	 */
	EXT("EXT",WORD,new Configuration( sizes(WORD,LONG) , types(DATA_REGISTER_DIRECT) ) )
	{
		@Override
		public void assemble(InstructionNode ins, ICompilationContext context)
		{
			final BitOutputStream bits = new BitOutputStream();
			bits.writeBits( 0b010010001 , 9 );
			SizeEncoding.SINGLE_BIT.write( ins.getEffectiveSize() , bits );
			bits.writeBits( 0b000 , 3 );
			bits.writeBits( EffectiveAddress.register( ins.operand(0) ) , 3 );
			context.writeWord( bits );
		}
	},
	/*
	 * SWAP Dn        0100 1000 0100 0rrr
	 */
	SWAP("SWAP",WORD,new Configuration( sizes(WORD) , types(DATA_REGISTER_DIRECT) ) )
	{
		@Override
		public void assemble(InstructionNode ins, ICompilationContext context)
		{
			final BitOutputStream bits = new BitOutputStream();
			bits.writeBits( 0b0100100001000 , 13 );
			bits.writeBits( EffectiveAddress.register( ins.operand(0) ) , 3 );
			context.writeWord( bits );
		}
	},
	/*
	 * PEA <ea>       0100 1000 01 eeeeee
	 */
	PEA("PEA",LONG,new Configuration( sizes(LONG) , OperandType.CONTROL ) )
	{
		@Override
		public void assemble(InstructionNode ins, ICompilationContext context)
		{
			final Operand operand = ins.operand(0);
			final BitOutputStream bits = new BitOutputStream();
			bits.writeBits( 0b0100100001 , 10 );
			EffectiveAddress.write( operand , bits );
			context.writeWord( bits );
			EffectiveAddress.writeExtensionWords( operand , LONG , context );
		}
	},
	/*
	 * ORI #xxx,<ea>  0000 0000 ss eeeeee
	 * ORI #xxx,CCR   0000 0000 0011 1100
	 * ORI #xxx,SR    0000 0000 0111 1100
	 */
	ORI("ORI",WORD,
			new Configuration( sizes(BYTE,WORD,LONG) , types(IMMEDIATE) , OperandType.DATA_ALTERABLE ),
			new Configuration( sizes(BYTE) , types(IMMEDIATE) , types(CONDITION_CODE_REGISTER) ),
			new Configuration( sizes(WORD) , types(IMMEDIATE) , types(STATUS_REGISTER) ) )
	{
		@Override public void assemble(InstructionNode ins, ICompilationContext context) { assembleImmediate( ins , context , 0b00000000 ); }
	},
	ANDI("ANDI",WORD,
			new Configuration( sizes(BYTE,WORD,LONG) , types(IMMEDIATE) , OperandType.DATA_ALTERABLE ),
			new Configuration( sizes(BYTE) , types(IMMEDIATE) , types(CONDITION_CODE_REGISTER) ),
			new Configuration( sizes(WORD) , types(IMMEDIATE) , types(STATUS_REGISTER) ) )
	{
		@Override public void assemble(InstructionNode ins, ICompilationContext context) { assembleImmediate( ins , context , 0b00000010 ); }
	},
	EORI("EORI",WORD,
			new Configuration( sizes(BYTE,WORD,LONG) , types(IMMEDIATE) , OperandType.DATA_ALTERABLE ),
			new Configuration( sizes(BYTE) , types(IMMEDIATE) , types(CONDITION_CODE_REGISTER) ),
			new Configuration( sizes(WORD) , types(IMMEDIATE) , types(STATUS_REGISTER) ) )
	{
		@Override public void assemble(InstructionNode ins, ICompilationContext context) { assembleImmediate( ins , context , 0b00001010 ); }
	};

	public final String code;
	public final Size defaultSize;
	private final List<Configuration> configurations;

	private Opcode(String code,Size defaultSize,Configuration... configurations)
	{
		this.code = code;
		this.defaultSize = defaultSize;
		this.configurations = Collections.unmodifiableList( Arrays.asList( configurations ) );
	}

	public List<Configuration> getConfigurations() {
		return configurations;
	}

	/**
	 * Emits the machine code for an instruction.
	 *
	 * The instruction must already have passed the {@link ConfigurationValidator}.
	 *
	 * @param ins
	 * @param context
	 * @throws de.codesourcery.m68k.parser.ParseException if an operand value does not fit its extension field
	 */
	public abstract void assemble(InstructionNode ins, ICompilationContext context);

	/**
	 * Returns the opcode with the given code.
	 *
	 * @param code mnemonic, matched exactly
	 * @return opcode or <code>null</code>
	 */
	public static Opcode getOpcode(String code)
	{
		for ( Opcode op : values() ) {
			if ( op.code.equals( code ) ) {
				return op;
			}
		}
		return null;
	}

	/**
	 * Determines the size of an instruction written without size suffix.
	 *
	 * This is the opcode's default size unless none of the configurations accepting
	 * the operands supports it and those configurations agree on a single size
	 * (<code>ORI #1,CCR</code> is a byte operation).
	 *
	 * @param explicitSize size from the source, may be <code>null</code>
	 * @param operands
	 * @return
	 */
	public Size resolveSize(Size explicitSize,List<Operand> operands)
	{
		if ( explicitSize != null ) {
			return explicitSize;
		}
		final Set<Size> candidates = EnumSet.noneOf( Size.class );
		for ( Configuration config : configurations )
		{
			if ( config.matches( operands ) )
			{
				if ( config.supports( defaultSize ) ) {
					return defaultSize;
				}
				candidates.addAll( config.getSizes() );
			}
		}
		return candidates.size() == 1 ? candidates.iterator().next() : defaultSize;
	}

	private static Set<Size> sizes(Size... sizes) {
		return EnumSet.copyOf( Arrays.asList( sizes ) );
	}

	private static Set<OperandType> types(OperandType... types) {
		return EnumSet.copyOf( Arrays.asList( types ) );
	}

	/*
	 * template (8) | size (2) | mode (3) | register (3)
	 */
	private static void assembleSingleOperand(InstructionNode ins, ICompilationContext context,int template)
	{
		final Operand operand = ins.operand(0);
		final Size size = ins.getEffectiveSize();

		final BitOutputStream bits = new BitOutputStream();
		bits.writeBits( template , 8 );
		SizeEncoding.ZERO_BASED.write( size , bits );
		EffectiveAddress.write( operand , bits );
		context.writeWord( bits );

		EffectiveAddress.writeExtensionWords( operand , size , context );
	}

	/*
	 * <ea> destination:  template (8) | size (2) | mode (3) | register (3) , immediate data , destination extension
	 * CCR destination:   template (8) | 0011 1100 , immediate byte
	 * SR destination:    template (8) | 0111 1100 , immediate word
	 */
	private static void assembleImmediate(InstructionNode ins, ICompilationContext context,int template)
	{
		final Immediate source = (Immediate) ins.operand(0);
		final Operand destination = ins.operand(1);
		final Size size = ins.getEffectiveSize();

		final BitOutputStream bits = new BitOutputStream();
		bits.writeBits( template , 8 );
		switch( destination.getType() )
		{
			case CONDITION_CODE_REGISTER:
				bits.writeBits( 0b00111100 , 8 );
				context.writeWord( bits );
				EffectiveAddress.writeImmediate( source , BYTE , context );
				return;
			case STATUS_REGISTER:
				bits.writeBits( 0b01111100 , 8 );
				context.writeWord( bits );
				EffectiveAddress.writeImmediate( source , WORD , context );
				return;
			default:
				SizeEncoding.ZERO_BASED.write( size , bits );
				EffectiveAddress.write( destination , bits );
				context.writeWord( bits );
				EffectiveAddress.writeImmediate( source , size , context );
				EffectiveAddress.writeExtensionWords( destination , size , context );
		}
	}
}
