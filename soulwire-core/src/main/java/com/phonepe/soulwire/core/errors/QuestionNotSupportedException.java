package com.phonepe.soulwire.core.errors;

/**
 * The client handling requests cannot present interactive questions to the user.
 * The message is meant to be passed back to the model verbatim.
 */
public class QuestionNotSupportedException extends SoulException {
    public QuestionNotSupportedException() {
        super(ErrorType.QUESTION_NOT_SUPPORTED);
    }
}
