package com.converge.core.plan;

/**
 * Exhaustive dispatch over instruction variants.
 */
public interface InstructionVisitor<R> {

    R visitApiCall(ApiCall call);

    R visitStoreValue(StoreValue store);

    R visitStoreMultipleValue(StoreMultipleValue store);

    R visitCopyVariable(CopyVariable copy);

    R visitCopyVariableFromDict(CopyVariableFromDict copy);

    R visitRecordResourceVariable(RecordResourceVariable record);

    R visitRecordResourceValue(RecordResourceValue record);

    R visitJpSearch(JpSearch search);

    R visitBuiltinFunction(BuiltinFunction function);
}
