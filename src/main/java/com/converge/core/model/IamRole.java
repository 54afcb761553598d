package com.converge.core.model;

/**
 * A role a function executes with, either managed here or created elsewhere.
 */
public interface IamRole extends Resource {
}
