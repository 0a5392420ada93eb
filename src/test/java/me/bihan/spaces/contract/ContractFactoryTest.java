package me.bihan.spaces.contract;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContractFactoryTest {

    private final ContractFactory factory = new ContractFactory("media");

    @Test
    void contractsCarryTheBoundBucket() {
        Contract contract = factory.newContract("videos/ep1.mkv", Path.of("ep1.mkv"));

        assertThat(contract.getBucket()).isEqualTo("media");
        assertThat(contract.getKey()).isEqualTo("videos/ep1.mkv");
        assertThat(contract.getDestination()).isEqualTo(Path.of("ep1.mkv"));
        assertThat(contract.getOptions()).isEmpty();
    }

    @Test
    void everyContractGetsADistinctId() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(factory.newContract("same-key", Path.of("same")).getId());
        }

        assertThat(ids).hasSize(1000);
    }

    @Test
    void optionsAreCopied() {
        Map<String, String> options = new HashMap<>();
        options.put("VersionId", "v1");

        Contract contract = factory.newContract("key", Path.of("key"), options);
        options.put("VersionId", "v2");

        assertThat(contract.getOptions()).containsExactly(Map.entry("VersionId", "v1"));
        assertThatThrownBy(() -> contract.getOptions().put("RequestPayer", "requester"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullOptionsMeanNone() {
        assertThat(factory.newContract("key", Path.of("key"), null).getOptions()).isEmpty();
    }

    @Test
    void rejectsBlankBucket() {
        assertThatThrownBy(() -> new ContractFactory(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ContractFactory(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMissingKey() {
        assertThatThrownBy(() -> factory.newContract(null, Path.of("x"))).isInstanceOf(NullPointerException.class);
    }
}
