package com.demoBank.advisor.guard.prompt;

/**
 * Fixed refusal texts used when a request asks for investment execution or recommendations.
 */
public class RefusalTemplate {

    private static final String REFUSAL_EN = """
            I cannot execute or recommend buying or selling securities.
            I can help with cashflow, budgeting, savings goals and non-investment risk planning.""";

    private static final String REFUSAL_VI = """
            Tôi không thể thực hiện hoặc khuyến nghị mua bán chứng khoán.
            Tôi có thể hỗ trợ về dòng tiền, ngân sách, mục tiêu tiết kiệm và rủi ro phi đầu tư.""";

    private RefusalTemplate() {}

    public static String render(boolean vietnamese, String disclaimer) {
        String body = vietnamese ? REFUSAL_VI : REFUSAL_EN;
        if (disclaimer == null || disclaimer.isBlank()) {
            return body;
        }
        return body + "\n\n" + disclaimer.trim();
    }
}
