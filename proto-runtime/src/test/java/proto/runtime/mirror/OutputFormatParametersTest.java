package proto.runtime.mirror;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OutputFormatParameters 测试")
class OutputFormatParametersTest {

    @Test
    @DisplayName("默认：数组上限 4，深度不限")
    void testDefaults() {
        OutputFormatParameters params = new OutputFormatParameters();
        assertThat(params.getMaxArraySize()).isEqualTo(4);
        assertThat(params.getMaxOutputDepth()).isEqualTo(-1);
        for (int i = 0; i < 100; i++) {
            assertThat(params.continueOutputTrace()).isTrue();
        }
        assertThat(params.getCurrentOutputDepth()).isEqualTo(-1);
    }

    @Test
    @DisplayName("深度耗尽后拒绝且不再递减")
    void testDepthExhaustion() {
        OutputFormatParameters params = new OutputFormatParameters(4, 2);
        assertThat(params.continueOutputTrace()).isTrue();
        assertThat(params.continueOutputTrace()).isTrue();
        assertThat(params.continueOutputTrace()).isFalse();
        assertThat(params.continueOutputTrace()).isFalse();
        assertThat(params.getCurrentOutputDepth()).isZero();

        params.restoreOutputTraceDepth();
        params.restoreOutputTraceDepth();
        assertThat(params.getCurrentOutputDepth()).isEqualTo(2);
    }

    @Test
    @DisplayName("重置回到最大深度")
    void testReset() {
        OutputFormatParameters params = new OutputFormatParameters(4, 3);
        params.continueOutputTrace();
        params.resetOutputDepth();
        assertThat(params.getCurrentOutputDepth()).isEqualTo(3);
    }
}
