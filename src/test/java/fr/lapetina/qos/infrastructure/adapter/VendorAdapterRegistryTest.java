package fr.lapetina.qos.infrastructure.adapter;

import fr.lapetina.qos.domain.exception.UnsupportedDeviceException;
import fr.lapetina.qos.domain.model.DeviceVendor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VendorAdapterRegistryTest {

    @Test
    @DisplayName("should register every command-line vendor by default")
    void shouldRegisterDefaults() {
        VendorAdapterRegistry registry = VendorAdapterRegistry.withDefaults();

        assertThat(registry.get(DeviceVendor.CISCO_IOS)).isInstanceOf(CiscoIosAdapter.class);
        assertThat(registry.get(DeviceVendor.JUNIPER_JUNOS)).isInstanceOf(JuniperJunosAdapter.class);
        assertThat(registry.get(DeviceVendor.LINUX_TC)).isInstanceOf(LinuxTcAdapter.class);
        assertThat(registry.supports(DeviceVendor.OPENFLOW)).isFalse();
    }

    @Test
    @DisplayName("should report OpenFlow switches as unsupported for CLI rendering")
    void shouldRejectOpenFlow() {
        assertThatThrownBy(() -> VendorAdapterRegistry.withDefaults().get(DeviceVendor.OPENFLOW))
                .isInstanceOf(UnsupportedDeviceException.class);
    }

    @Test
    @DisplayName("should refuse two adapters for the same vendor")
    void shouldRejectDuplicates() {
        assertThatThrownBy(() -> new VendorAdapterRegistry(List.of(new LinuxTcAdapter(), new LinuxTcAdapter())))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
