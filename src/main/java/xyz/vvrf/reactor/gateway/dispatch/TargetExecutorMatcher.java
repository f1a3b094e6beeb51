package xyz.vvrf.reactor.gateway.dispatch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.gateway.core.GatewayErrorCode;
import xyz.vvrf.reactor.gateway.core.GatewayException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 判断 target_executor 正则是否选中某个节点。
 * <p>
 * 正则从节点名开头匹配 (不要求匹配到结尾)；空正则选中所有节点。编译结果按正则文本缓存。
 */
@Slf4j
public class TargetExecutorMatcher {

    private static final long DEFAULT_CACHE_SIZE = 1024;

    private final Cache<String, Pattern> patterns;

    public TargetExecutorMatcher() {
        this(DEFAULT_CACHE_SIZE);
    }

    public TargetExecutorMatcher(long cacheSize) {
        this.patterns = Caffeine.newBuilder().maximumSize(cacheSize).build();
    }

    /**
     * @throws GatewayException BAD_REQUEST，当正则不合法
     */
    public boolean matches(String targetExecutor, String node) {
        if (targetExecutor == null || targetExecutor.isEmpty()) {
            return true;
        }
        return compile(targetExecutor).matcher(node).lookingAt();
    }

    /**
     * 校验正则，在入口处调用以便尽早拒绝请求。
     *
     * @throws GatewayException BAD_REQUEST，当正则不合法
     */
    public void validate(String targetExecutor) {
        if (targetExecutor != null && !targetExecutor.isEmpty()) {
            compile(targetExecutor);
        }
    }

    private Pattern compile(String regex) {
        try {
            return patterns.get(regex, Pattern::compile);
        } catch (PatternSyntaxException e) {
            log.debug("非法的 target_executor 正则 '{}': {}", regex, e.getDescription());
            throw new GatewayException(GatewayErrorCode.BAD_REQUEST,
                    String.format("target_executor '%s' 不是合法的正则表达式: %s", regex, e.getDescription()), e);
        }
    }
}
