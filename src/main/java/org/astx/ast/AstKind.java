package org.astx.ast;

/**
 * Tag identifying the variant of a node. Every concrete node class reports exactly one kind.
 */
public enum AstKind {
    // region Containers and generic expressions
    BLOCK,
    ARGUMENTS,
    MODULE,
    PACKAGE,
    PROGRAM,
    TARGET,
    IDENTIFIER,
    PARENTHESIZED_EXPR,
    TYPE_CAST_EXPR,
    SUBSCRIPT_EXPR,
    // endregion

    // region Data types
    INTEGER_TYPE,
    FLOAT_TYPE,
    COMPLEX_TYPE,
    BOOLEAN_TYPE,
    CHAR_TYPE,
    STRING_TYPE,
    TEMPORAL_TYPE,
    LIST_TYPE,
    SET_TYPE,
    MAP_TYPE,
    TUPLE_TYPE,
    NAMED_TYPE,
    FUNCTION_TYPE,
    NONE_TYPE,
    UNDEFINED_TYPE,
    ANY_TYPE,
    // endregion

    // region Literals
    LITERAL_INTEGER,
    LITERAL_FLOAT,
    LITERAL_COMPLEX,
    LITERAL_BOOLEAN,
    LITERAL_CHAR,
    LITERAL_STRING,
    LITERAL_NONE,
    LITERAL_DATE,
    LITERAL_TIME,
    LITERAL_DATE_TIME,
    LITERAL_TIMESTAMP,
    LITERAL_LIST,
    LITERAL_SET,
    LITERAL_TUPLE,
    LITERAL_DICT,
    JOINED_STR,
    FORMATTED_VALUE,
    // endregion

    // region Operators
    UNARY_OP,
    BINARY_OP,
    COMPARE_OP,
    BOOL_BINARY_OP,
    AUG_ASSIGN,
    WALRUS_OP,
    STARRED,
    // endregion

    // region Variables
    VARIABLE,
    VARIABLE_DECLARATION,
    INLINE_VARIABLE_DECLARATION,
    VARIABLE_ASSIGNMENT,
    DELETE_STMT,
    // endregion

    // region Control flow
    IF_STMT,
    IF_EXPR,
    FOR_RANGE_LOOP_STMT,
    FOR_RANGE_LOOP_EXPR,
    ASYNC_FOR_RANGE_LOOP_STMT,
    ASYNC_FOR_RANGE_LOOP_EXPR,
    FOR_COUNT_LOOP_STMT,
    FOR_COUNT_LOOP_EXPR,
    WHILE_STMT,
    WHILE_EXPR,
    DO_WHILE_STMT,
    DO_WHILE_EXPR,
    BREAK_STMT,
    CONTINUE_STMT,
    GOTO_STMT,
    CASE_STMT,
    SWITCH_STMT,
    THROW_STMT,
    CATCH_HANDLER_STMT,
    EXCEPTION_HANDLER_STMT,
    FINALLY_HANDLER_STMT,
    WITH_ITEM,
    WITH_STMT,
    // endregion

    // region Comprehensions
    COMPREHENSION_CLAUSE,
    LIST_COMPREHENSION,
    SET_COMPREHENSION,
    DICT_COMPREHENSION,
    GENERATOR_EXPR,
    // endregion

    // region Callables
    ARGUMENT,
    FUNCTION_PROTOTYPE,
    FUNCTION_DEF,
    FUNCTION_ASYNC_DEF,
    FUNCTION_CALL,
    FUNCTION_RETURN,
    LAMBDA_EXPR,
    AWAIT_EXPR,
    YIELD_EXPR,
    YIELD_FROM_EXPR,
    // endregion

    // region Classes
    CLASS_DECL_STMT,
    CLASS_DEF_STMT,
    STRUCT_DECL_STMT,
    STRUCT_DEF_STMT,
    ENUM_DECL_STMT,
    // endregion

    // region Packages
    ALIAS_EXPR,
    IMPORT_STMT,
    IMPORT_FROM_STMT,
    IMPORT_EXPR,
    IMPORT_FROM_EXPR
    // endregion
}
