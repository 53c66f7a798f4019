/**
 * The frontend package contains the classes that take statement and
 * expression trees, remove side effects and control-dependent operators
 * from them, and generate goto programs.
 */
package exm.gotocc.frontend;
