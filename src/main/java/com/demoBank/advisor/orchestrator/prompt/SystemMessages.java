package com.demoBank.advisor.orchestrator.prompt;

/**
 * Fixed user-facing messages for short-circuited turns.
 */
public class SystemMessages {

    private SystemMessages() {}

    public static String encodingFailFast(boolean vietnamese) {
        return vietnamese
                ? "Tin nhắn của bạn bị lỗi mã hóa ký tự nên không thể đọc chính xác. Vui lòng gõ lại và gửi lần nữa."
                : "Your message could not be read because of a text encoding problem. Please retype it and send it again.";
    }

    public static String unableToComplete(boolean vietnamese) {
        return vietnamese
                ? "Xin lỗi, tôi chưa thể hoàn tất yêu cầu của bạn lúc này. Vui lòng thử lại sau."
                : "Sorry, I was unable to complete your request right now. Please try again later.";
    }
}
