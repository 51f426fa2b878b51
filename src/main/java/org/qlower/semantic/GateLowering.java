package org.qlower.semantic;

import org.qlower.circuit.*;
import org.qlower.parser.QasmParser;
import org.qlower.semantic.value.Arithmetic;
import org.qlower.semantic.value.QubitValue;
import org.qlower.semantic.value.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a gate call into exactly one {@link Instruction}, dispatching on the gate name through
 * {@link InstructionKind}. Counts of operands and angles must match the gate's contract.
 */
public class GateLowering
{
	private final ExpressionEvaluator evaluator;

	public GateLowering(ExpressionEvaluator evaluator)
	{
		this.evaluator = evaluator;
	}

	public Instruction lower(QasmParser.GateCallStatementContext ctx)
	{
		String gate = ctx.Identifier().getText();

		List<Integer> qubits = new ArrayList<>();
		for (QasmParser.GateOperandContext operand : ctx.gateOperandList().gateOperand())
		{
			qubits.add(resolveQubit(operand));
		}

		List<Double> angles = new ArrayList<>();
		if (ctx.expressionList() != null)
		{
			for (QasmParser.ExpressionContext expression : ctx.expressionList().expression())
			{
				try
				{
					angles.add(Arithmetic.toDouble(evaluator.evaluate(expression)));
				}
				catch (LoweringException e)
				{
					throw e.at(expression);
				}
			}
		}

		try
		{
			return lower(gate, qubits, angles);
		}
		catch (LoweringException e)
		{
			throw e.at(ctx);
		}
	}

	/**
	 * Builds the instruction for an already resolved gate call.
	 *
	 * @param gate   The gate name as written in source.
	 * @param qubits Resolved qubit indices, in operand order.
	 * @param angles Angles in radians, in argument order.
	 * @return The matching instruction.
	 * @throws LoweringException {@link ErrorKind#UNKNOWN_GATE} for a name outside the instruction set,
	 *                           {@link ErrorKind#ARITY_MISMATCH} when the counts do not match.
	 */
	public static Instruction lower(String gate, List<Integer> qubits, List<Double> angles)
	{
		InstructionKind kind = InstructionKind.fromGateName(gate)
				.orElseThrow(() -> new LoweringException(ErrorKind.UNKNOWN_GATE, "Unknown gate: " + gate));

		if (qubits.size() != kind.getQubitArity())
		{
			throw new LoweringException(ErrorKind.ARITY_MISMATCH,
					"Gate '" + gate + "' expects " + kind.getQubitArity() + " qubit operand(s), got " + qubits.size());
		}
		if (angles.size() != kind.getAngleArity())
		{
			throw new LoweringException(ErrorKind.ARITY_MISMATCH,
					"Gate '" + gate + "' expects " + kind.getAngleArity() + " angle(s), got " + angles.size());
		}

		return switch (kind)
		{
			case CCX -> new CCX(qubits.get(0), qubits.get(1), qubits.get(2));
			case CRZ -> new ControlledRZ(qubits.get(0), qubits.get(1), angles.get(0));
			case CX -> new CNOT(qubits.get(0), qubits.get(1));
			case SWAP -> new Swap(qubits.get(0), qubits.get(1));
			case H, S, X, Y, Z -> new SingleQubitGate(kind, qubits.get(0));
			case RX, RY, RZ -> new Rotation(kind, qubits.get(0), angles.get(0));
		};
	}

	/**
	 * Resolves {@code q} or {@code q[i]} to a qubit index. Anything that is not a single qubit,
	 * such as a whole register or a classical bit, is a {@link ErrorKind#TYPE_MISMATCH}.
	 */
	public int resolveQubit(QasmParser.GateOperandContext operand)
	{
		QasmParser.IndexedIdentifierContext identifier = operand.indexedIdentifier();
		if (identifier == null)
		{
			throw LoweringException.at(operand, ErrorKind.MALFORMED_TREE, "Unknown operand: " + operand.getText());
		}

		Value value = evaluator.resolveIndexed(identifier, identifier.Identifier().getText(), identifier.indexOperator());
		if (value instanceof QubitValue qubit)
		{
			return qubit.getIndex();
		}
		throw LoweringException.at(operand, ErrorKind.TYPE_MISMATCH, "Qubit expected: '" + operand.getText() + "' is " + value.describe());
	}
}
