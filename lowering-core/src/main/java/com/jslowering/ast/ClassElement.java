package com.jslowering.ast;

/**
 * Member of a class body: a method or an accessor.
 */
public sealed interface ClassElement extends Node permits FunctionDeclaration, GetAccessorDeclaration, SetAccessorDeclaration {
}
