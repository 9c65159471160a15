package com.jslowering.ast;

/**
 * Member of an object literal.
 */
public sealed interface ObjectMember extends Node permits Property, GetAccessorDeclaration, SetAccessorDeclaration {
}
