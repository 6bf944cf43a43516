package com.work.federation.web.dto;

/**
 * 统一错误应答：step 仅在协商运行失败时出现。
 */
public class ErrorView {

    private String step;
    private String error;
    private String message;

    public ErrorView() {
    }

    public ErrorView(String step, String error, String message) {
        this.step = step;
        this.error = error;
        this.message = message;
    }

    public String getStep() {
        return step;
    }

    public void setStep(String step) {
        this.step = step;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
