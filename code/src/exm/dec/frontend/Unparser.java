package exm.dec.frontend;

import org.apache.commons.lang3.StringUtils;

import exm.dec.ast.ASTVisitor;
import exm.dec.ast.Assignment;
import exm.dec.ast.BinaryOperator;
import exm.dec.ast.Block;
import exm.dec.ast.Exponentiation;
import exm.dec.ast.FloatDiv;
import exm.dec.ast.IntDiv;
import exm.dec.ast.Literal;
import exm.dec.ast.Minus;
import exm.dec.ast.Modulus;
import exm.dec.ast.Plus;
import exm.dec.ast.Return;
import exm.dec.ast.Statement;
import exm.dec.ast.Times;
import exm.dec.ast.Variable;
import exm.dec.common.Settings;

/**
 * Render a syntax tree back to DEC source text.  The parameter is the
 * indentation level of the node.  Binary operations are always fully
 * parenthesized.
 */
public class Unparser implements ASTVisitor<Integer, String> {

  private final int indentWidth;

  public Unparser() {
    this(Settings.indentWidth());
  }

  public Unparser(int indentWidth) {
    this.indentWidth = Math.max(indentWidth, 0);
  }

  public String indent(int level) {
    if (level <= 0) {
      return "";
    }
    return StringUtils.repeat(' ', level * indentWidth);
  }

  @Override
  public String visit(Plus node, Integer level) {
    return binary(node, level);
  }

  @Override
  public String visit(Minus node, Integer level) {
    return binary(node, level);
  }

  @Override
  public String visit(Times node, Integer level) {
    return binary(node, level);
  }

  @Override
  public String visit(FloatDiv node, Integer level) {
    return binary(node, level);
  }

  @Override
  public String visit(IntDiv node, Integer level) {
    return binary(node, level);
  }

  @Override
  public String visit(Modulus node, Integer level) {
    return binary(node, level);
  }

  @Override
  public String visit(Exponentiation node, Integer level) {
    return binary(node, level);
  }

  private String binary(BinaryOperator node, Integer level) {
    return "(" + node.getLeft().accept(this, level) + " "
         + node.getOp().symbol() + " "
         + node.getRight().accept(this, level) + ")";
  }

  @Override
  public String visit(Literal node, Integer level) {
    return node.getValue().toString();
  }

  @Override
  public String visit(Variable node, Integer level) {
    return node.getName();
  }

  @Override
  public String visit(Assignment node, Integer level) {
    return indent(level) + node.getTarget().getName() + " := "
         + node.getValue().accept(this, level);
  }

  @Override
  public String visit(Return node, Integer level) {
    return indent(level) + "return " + node.getValue().accept(this, level);
  }

  @Override
  public String visit(Block node, Integer level) {
    StringBuilder sb = new StringBuilder();
    String ind = indent(level);
    int inner = Math.max(level, 0) + 1;
    sb.append(ind).append("{\n");
    for (Statement stmt: node.getStatements()) {
      sb.append(stmt.accept(this, inner));
      sb.append("\n");
    }
    sb.append(ind).append("}");
    return sb.toString();
  }
}
