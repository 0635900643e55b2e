package com.quarkparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.quarkparser.ast.Arguments;
import com.quarkparser.ast.Block;
import com.quarkparser.ast.CompilationUnit;
import com.quarkparser.ast.ForLoop;
import com.quarkparser.ast.Function;
import com.quarkparser.ast.FunctionCall;
import com.quarkparser.ast.Identifier;
import com.quarkparser.ast.IfStatement;
import com.quarkparser.ast.Literal;
import com.quarkparser.ast.ModuleDeclaration;
import com.quarkparser.ast.Operator;
import com.quarkparser.ast.Pattern;
import com.quarkparser.ast.Pipe;
import com.quarkparser.ast.Ternary;
import com.quarkparser.ast.UseDeclaration;
import com.quarkparser.ast.WhenStatement;
import com.quarkparser.ast.WhileLoop;

/**
 * Type discriminator for AST nodes. The "type" property holds the {@code NodeType} name of the node.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = CompilationUnit.class, name = "CompilationUnit"),
    @JsonSubTypes.Type(value = Block.class, name = "Block"),
    @JsonSubTypes.Type(value = IfStatement.class, name = "IfStatement"),
    @JsonSubTypes.Type(value = WhenStatement.class, name = "WhenStatement"),
    @JsonSubTypes.Type(value = Pattern.class, name = "Pattern"),
    @JsonSubTypes.Type(value = ForLoop.class, name = "ForLoop"),
    @JsonSubTypes.Type(value = WhileLoop.class, name = "WhileLoop"),
    @JsonSubTypes.Type(value = Function.class, name = "Function"),
    @JsonSubTypes.Type(value = FunctionCall.class, name = "FunctionCall"),
    @JsonSubTypes.Type(value = Arguments.class, name = "Arguments"),
    @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
    @JsonSubTypes.Type(value = Literal.class, name = "Literal"),
    @JsonSubTypes.Type(value = Operator.class, name = "Operator"),
    @JsonSubTypes.Type(value = Ternary.class, name = "Ternary"),
    @JsonSubTypes.Type(value = Pipe.class, name = "Pipe"),
    @JsonSubTypes.Type(value = ModuleDeclaration.class, name = "Module"),
    @JsonSubTypes.Type(value = UseDeclaration.class, name = "Use")
})
public abstract class NodeMixin {
}
