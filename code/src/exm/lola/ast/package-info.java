/**
 * Abstract syntax tree of a specification, as handed over by the parser.
 * Nodes carry source spans for error reporting but no semantic
 * information: name resolution happens during lowering.
 */
package exm.lola.ast;
