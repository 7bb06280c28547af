package de.codesourcery.m68k.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.Constants;
import de.codesourcery.m68k.assembler.ConfigurationValidator;
import de.codesourcery.m68k.assembler.Opcode;
import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.assembler.Size;
import de.codesourcery.m68k.parser.ast.AddressRegister;
import de.codesourcery.m68k.parser.ast.AddressRegisterDirect;
import de.codesourcery.m68k.parser.ast.AddressRegisterIndirect;
import de.codesourcery.m68k.parser.ast.AddressRegisterIndirectDisplacement;
import de.codesourcery.m68k.parser.ast.AddressRegisterIndirectIndex;
import de.codesourcery.m68k.parser.ast.AddressRegisterIndirectPostIncrement;
import de.codesourcery.m68k.parser.ast.AddressRegisterIndirectPreDecrement;
import de.codesourcery.m68k.parser.ast.AbsoluteLong;
import de.codesourcery.m68k.parser.ast.AbsoluteWord;
import de.codesourcery.m68k.parser.ast.CommentNode;
import de.codesourcery.m68k.parser.ast.ConditionCodeRegister;
import de.codesourcery.m68k.parser.ast.DataRegister;
import de.codesourcery.m68k.parser.ast.DataRegisterDirect;
import de.codesourcery.m68k.parser.ast.Immediate;
import de.codesourcery.m68k.parser.ast.IndexedRegister;
import de.codesourcery.m68k.parser.ast.InstructionNode;
import de.codesourcery.m68k.parser.ast.LabelNode;
import de.codesourcery.m68k.parser.ast.Operand;
import de.codesourcery.m68k.parser.ast.PCRelativeDisplacement;
import de.codesourcery.m68k.parser.ast.PCRelativeIndex;
import de.codesourcery.m68k.parser.ast.Program;
import de.codesourcery.m68k.parser.ast.Register;
import de.codesourcery.m68k.parser.ast.Statement;
import de.codesourcery.m68k.parser.ast.StatusRegister;
import de.codesourcery.m68k.parser.ast.UserStackPointer;

/**
 * Turns the tokens of a source file into a {@link Program}.
 *
 * Every source line is parsed on its own. Mistakes are reported to the
 * {@link IErrorCollector} and parsing continues with the next line, so a single
 * run reports every problem in the file.
 */
public class Parser
{
	private static final Pattern REGISTER_NAME = Pattern.compile("^[AD][0-9]+$");

	private static final long MAX_NEGATED_NUMBER = -(long) Integer.MIN_VALUE;

	private final IErrorCollector errors;

	private boolean debug = Constants.PARSER_DEBUG;

	public Parser(IErrorCollector errors)
	{
		Validate.notNull( errors , "errors must not be NULL");
		this.errors = errors;
	}

	public void setDebug(boolean debug) {
		this.debug = debug;
	}

	/**
	 * Lexes and parses source text.
	 *
	 * @param source
	 * @param errors
	 * @return
	 */
	public static Program parse(String source,IErrorCollector errors) {
		return new Parser( errors ).parse( Lexer.tokenize( source , errors ) );
	}

	public Program parse(List<Token> tokens)
	{
		Validate.notNull( tokens , "tokens must not be NULL");

		final List<Statement> statements = new ArrayList<>();
		final Map<LabelNode,Integer> labelsToIndex = new LinkedHashMap<>();
		final Set<LabelNode> labelsWaitingForCode = new LinkedHashSet<>();

		for ( Map.Entry<Integer,List<Token>> entry : groupByLine( tokens ).entrySet() )
		{
			final int line = entry.getKey();
			final List<Token> lineTokens = entry.getValue();

			// global label
			if ( lineTokens.size() >= 2 && lineTokens.get(0).hasType( TokenType.IDENTIFIER ) && lineTokens.get(1).hasType( TokenType.COLON ) )
			{
				labelsWaitingForCode.add( new LabelNode( lineTokens.get(0).location , lineTokens.get(0).text ) );
				lineTokens.subList( 0 , 2 ).clear();
			}
			// local label
			else if ( lineTokens.size() >= 3 && lineTokens.get(0).hasType( TokenType.DOT ) &&
					lineTokens.get(1).hasType( TokenType.IDENTIFIER ) && lineTokens.get(2).hasType( TokenType.COLON ) )
			{
				labelsWaitingForCode.add( new LabelNode( lineTokens.get(0).location , "."+lineTokens.get(1).text ) );
				lineTokens.subList( 0 , 3 ).clear();
			}

			Token comment = null;
			if ( ! lineTokens.isEmpty() && lineTokens.get( lineTokens.size() - 1 ).hasType( TokenType.COMMENT ) ) {
				comment = lineTokens.remove( lineTokens.size() - 1 );
			}

			if ( lineTokens.isEmpty() )
			{
				if ( comment != null ) {
					statements.add( new CommentNode( comment.location , comment.text ) );
				}
				continue;
			}

			final LineParserState state = new LineParserState( lineTokens , line );
			try
			{
				final InstructionNode ins = parseOperation( state );
				if ( ins != null )
				{
					for ( LabelNode label : labelsWaitingForCode ) {
						labelsToIndex.put( label , statements.size() );
					}
					labelsWaitingForCode.clear();
					statements.add( ins );
				}
			}
			catch(ParseException e)
			{
				report( e , state );
			}
		}

		for ( LabelNode label : labelsWaitingForCode )
		{
			errors.add( label.location , "There should be code after labels, but label "+label+
					" isn't followed by any statements." );
		}
		return new Program( statements , labelsToIndex );
	}

	private static Map<Integer,List<Token>> groupByLine(List<Token> tokens)
	{
		final Map<Integer,List<Token>> result = new LinkedHashMap<>();
		for ( Token token : tokens )
		{
			List<Token> list = result.get( token.location.line );
			if ( list == null ) {
				list = new ArrayList<>();
				result.put( token.location.line , list );
			}
			list.add( token );
		}
		return result;
	}

	private void report(ParseException e,LineParserState state)
	{
		final Location location = e.hasLocation() ? e.location : state.currentLocation();
		if ( debug ) {
			System.out.println("PARSE ERROR @ "+location+" ("+state+") : "+e.getMessage());
		}
		errors.add( location , e.getMessage() );
	}

	/**
	 * Parses a mnemonic with optional size suffix and operands.
	 *
	 * @param state
	 * @return instruction or <code>null</code> if the line could not be turned into one.
	 * Problems with the size or individual operands have already been reported in that case.
	 * @throws ParseException
	 */
	InstructionNode parseOperation(LineParserState state) throws ParseException
	{
		final Token identifier = state.expect( TokenType.IDENTIFIER , "an operation or directive identifier" );

		boolean failed = false;
		Size size = null;
		if ( state.consumeIf( TokenType.DOT ) )
		{
			try {
				size = parseSize( state );
			}
			catch(ParseException e)
			{
				report( e , state );
				failed = true;
			}
		}

		final List<Operand> operands = new ArrayList<>();
		if ( ! isEndOfOperands( state ) )
		{
			do
			{
				final int operandStart = state.position();
				try
				{
					operands.add( parseOperand( state ) );
					if ( ! isEndOfOperands( state ) && ! state.peek( TokenType.COMMA ) ) {
						throw new ParseException("Expected a comma or the end of the line after an operand, but found '"+state.peek().text+"' instead." , state.peek() );
					}
				}
				catch(ParseException e)
				{
					report( e , state );
					failed = true;
					state.skipToNextOperand( operandStart );
				}
			} while ( state.consumeIf( TokenType.COMMA ) );
		}

		// directives are not supported, only opcodes turn into statements
		final Opcode opcode = Opcode.getOpcode( identifier.text );
		if ( opcode == null )
		{
			if ( debug ) {
				System.out.println("Line "+state.line()+": no opcode '"+identifier.text+"', ignored");
			}
			return null;
		}
		if ( failed ) {
			return null;
		}

		try {
			ConfigurationValidator.validate( opcode , opcode.resolveSize( size , operands ) , operands );
		}
		catch(ParseException e) {
			throw new ParseException( e.getMessage() , identifier );
		}
		return new InstructionNode( identifier.location , opcode , size , operands );
	}

	private static boolean isEndOfOperands(LineParserState state) {
		return state.isAtEnd() || state.peek( TokenType.COMMENT );
	}

	Size parseSize(LineParserState state) throws ParseException
	{
		final Token token = state.expect( TokenType.IDENTIFIER , "a size (either B for byte, W for word or L for long word)" );
		final Size size = Size.fromString( token.text );
		if ( size == null )
		{
			throw new ParseException("A size was expected. That's either B for byte, W for word or L for long word. But "+
					token.text.toUpperCase()+" was given. That's not a valid size." , token );
		}
		return size;
	}

	/*
	 * Dn            D3
	 * An            A3
	 * (An)          (A3)
	 * (An)+         (A3)+
	 * -(An)         -(A3)
	 * (d16,An)      (12,A3)      12(A3)
	 * (d8,An,Xn.s)  (12,A3,D2.W) 12(A3,D2.W)
	 * (xxx).W       (1234).W
	 * (xxx).L       (1234).L
	 * (d16,PC)      (12,PC)      12(PC)
	 * (d8,PC,Xn.s)  (12,PC,A1.L) 12(PC,A1.L)
	 * #xxx          #12
	 * CCR / SR / USP
	 */
	Operand parseOperand(LineParserState state) throws ParseException
	{
		final Token first = state.peek();
		if ( first == null || first.hasType( TokenType.COMMENT ) ) {
			throw new ParseException("Expected an operand, but reached the end of the line." , state.currentLocation() );
		}
		final Location location = first.location;

		// Dn, An, CCR, SR or USP
		if ( first.hasType( TokenType.IDENTIFIER ) )
		{
			state.next();
			switch( first.text )
			{
				case "CCR": return new ConditionCodeRegister( location );
				case "SR":  return new StatusRegister( location );
				case "USP": return new UserStackPointer( location );
				default:
			}
			final Register register = Register.getRegister( first.text );
			if ( register == null )
			{
				checkRegisterIndex( first );
				throw new ParseException("Unexpected identifier "+first.text+"." , first );
			}
			switch( register.getType() )
			{
				case ADDRESS: return new AddressRegisterDirect( location , (AddressRegister) register );
				case DATA:    return new DataRegisterDirect( location , (DataRegister) register );
				case PC:      throw new ParseException("Unexpected identifier "+first.text+"." , first );
				default:
					throw new RuntimeException("Unhandled register type: "+register.getType());
			}
		}

		// #xxx
		if ( state.consumeIf( TokenType.HASH ) ) {
			return new Immediate( location , parseSignedNumber( state , "a value for an "+describe( OperandType.IMMEDIATE )+" operand" ) );
		}

		// -(An)
		if ( state.peek( TokenType.MINUS ) && state.peek( 1 , TokenType.PARENS_OPEN ) )
		{
			state.next();
			state.next();
			final AddressRegister register = expectAddressRegister( state , "An for a predecrement -(An) operand" );
			state.expect( TokenType.PARENS_CLOSE , "a closing parenthesis for an "+describe( OperandType.ADDRESS_REGISTER_INDIRECT_PRE_DECREMENT )+" operand" );
			return new AddressRegisterIndirectPreDecrement( location , register );
		}

		// d(An), d(An,Xn.s), d(PC), d(PC,Xn.s)
		if ( state.peek( TokenType.NUMBER ) || state.peek( TokenType.MINUS ) )
		{
			final long displacement = parseSignedNumber( state , "a displacement" );
			state.expect( TokenType.PARENS_OPEN , "an opening parenthesis after the displacement" );
			return parseDisplacedOperand( state , location , displacement );
		}

		state.expect( TokenType.PARENS_OPEN , "an operand" );

		// (An) and (An)+
		if ( state.peek( TokenType.IDENTIFIER ) )
		{
			final AddressRegister register = expectAddressRegister( state , "an address register" );
			state.expect( TokenType.PARENS_CLOSE , "a closing parenthesis for an address register operand" );
			if ( state.consumeIf( TokenType.PLUS ) ) {
				return new AddressRegisterIndirectPostIncrement( location , register );
			}
			return new AddressRegisterIndirect( location , register );
		}

		final long number = parseSignedNumber( state , "a number for a displaced or absolute operand" );

		// (xxx).W and (xxx).L
		if ( state.consumeIf( TokenType.PARENS_CLOSE ) )
		{
			state.expect( TokenType.DOT , "a dot for an absolute (xxx).s operand" );
			final Size size = parseSize( state );
			switch( size )
			{
				case WORD: return new AbsoluteWord( location , number );
				case LONG: return new AbsoluteLong( location , number );
				case BYTE:
					throw new ParseException("Only word (W) or long word (L) sizes are permitted after (xxx).s operand." , location );
				default:
					throw new RuntimeException("Unhandled size: "+size);
			}
		}

		// (d,An), (d,An,Xn.s), (d,PC), (d,PC,Xn.s)
		state.expect( TokenType.COMMA , "a comma after the displacement" );
		return parseDisplacedOperand( state , location , number );
	}

	/*
	 * Parses the part of a displaced operand that follows the displacement:
	 *
	 * An)  An,Xn.s)  PC)  PC,Xn.s)
	 */
	private Operand parseDisplacedOperand(LineParserState state,Location location,long displacement)
	{
		final Token baseToken = state.expect( TokenType.IDENTIFIER , "either An or PC for a displaced operand" );
		final Register base = toRegister( baseToken );
		if ( base.isDataRegister() ) {
			throw new ParseException("Data register cannot be displaced." , baseToken );
		}

		if ( state.consumeIf( TokenType.PARENS_CLOSE ) )
		{
			if ( base.isProgramCounter() ) {
				return new PCRelativeDisplacement( location , displacement );
			}
			return new AddressRegisterIndirectDisplacement( location , (AddressRegister) base , displacement );
		}

		final OperandType type = base.isProgramCounter() ? OperandType.PC_RELATIVE_INDEX : OperandType.ADDRESS_REGISTER_INDIRECT_INDEX;
		state.expect( TokenType.COMMA , "a comma for an "+describe( type )+" operand" );

		final Token indexToken = state.expect( TokenType.IDENTIFIER , "an index register" );
		final Register index = toRegister( indexToken );
		if ( index.isProgramCounter() ) {
			throw new ParseException("Expected index register, but found "+indexToken.text+"." , indexToken );
		}
		state.expect( TokenType.DOT , "a dot for an "+describe( type )+" operand" );
		final Token sizeToken = state.peek();
		final Size indexSize = parseSize( state );
		if ( indexSize == Size.BYTE ) {
			throw new ParseException("Only word (W) or long word (L) index sizes are permitted." , sizeToken );
		}
		state.expect( TokenType.PARENS_CLOSE , "a closing parenthesis for an "+describe( type )+" operand" );

		if ( base.isProgramCounter() ) {
			return new PCRelativeIndex( location , displacement , (IndexedRegister) index , indexSize );
		}
		return new AddressRegisterIndirectIndex( location , (AddressRegister) base , displacement , (IndexedRegister) index , indexSize );
	}

	/*
	 * Result is in range -$80000000 to $FFFFFFFF, i.e. fits 32 bits either signed or unsigned.
	 */
	private long parseSignedNumber(LineParserState state,String expected)
	{
		final boolean negative = state.consumeIf( TokenType.MINUS );
		final Token token = state.expect( TokenType.NUMBER , expected );
		final long value = token.longValue();
		if ( negative && value > MAX_NEGATED_NUMBER ) {
			throw new ParseException("Number out of range: -"+token.text+" does not fit into 32 bits." , token );
		}
		return negative ? -value : value;
	}

	private AddressRegister expectAddressRegister(LineParserState state,String expected)
	{
		final Token token = state.expect( TokenType.IDENTIFIER , expected );
		final Register register = toRegister( token );
		if ( ! register.isAddressRegister() ) {
			throw new ParseException("Expected "+expected+", but found "+token.text+" instead." , token );
		}
		return (AddressRegister) register;
	}

	private static Register toRegister(Token token)
	{
		final Register register = Register.getRegister( token.text );
		if ( register == null )
		{
			checkRegisterIndex( token );
			throw new ParseException("Expected a register, but found '"+token.text+"' instead." , token );
		}
		return register;
	}

	private static void checkRegisterIndex(Token token)
	{
		if ( REGISTER_NAME.matcher( token.text ).matches() ) {
			throw new ParseException("Register index "+token.text.substring(1)+" is out of range, only 0 to 7 are valid." , token );
		}
	}

	private static String describe(OperandType type) {
		return type.readableName+" "+type.shortName;
	}
}
