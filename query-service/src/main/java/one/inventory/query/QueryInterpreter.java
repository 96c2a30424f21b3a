package one.inventory.query;

/**
 * 把自然语言查询翻译成结构化意图
 */
public interface QueryInterpreter {

    /**
     * 单次调用，不重试
     *
     * @throws ConfigurationException       缺少 API Key
     * @throws UpstreamUnavailableException 无法连接或超时
     * @throws UpstreamErrorException       语言模型返回错误状态码
     * @throws MalformedResponseException   返回内容无法解析
     */
    InterpretedIntent interpret(String query);
}
