package com.dburyak.exercise.rpc.err;

import lombok.Getter;

@Getter
public class ArgsNotAssignableException extends ArgsUnmarshalException {
    private final Class<?> argsType;
    private final Class<?> targetType;

    /**
     * @param argsType type of the arguments, null if the arguments are null
     */
    public ArgsNotAssignableException(Class<?> argsType, Class<?> targetType) {
        super("args of type " + (argsType != null ? argsType.getName() : "null") + " are not assignable to "
                + targetType.getName());
        this.argsType = argsType;
        this.targetType = targetType;
    }
}
