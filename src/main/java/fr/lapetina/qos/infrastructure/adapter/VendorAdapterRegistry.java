package fr.lapetina.qos.infrastructure.adapter;

import fr.lapetina.qos.domain.exception.UnsupportedDeviceException;
import fr.lapetina.qos.domain.model.DeviceVendor;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Vendor to adapter lookup. OpenFlow switches have no CLI adapter; they go through the SDN service.
 */
public final class VendorAdapterRegistry {

    private final Map<DeviceVendor, VendorAdapter> adapters = new EnumMap<>(DeviceVendor.class);

    public VendorAdapterRegistry(Collection<? extends VendorAdapter> adapters) {
        for (VendorAdapter adapter : adapters) {
            if (this.adapters.putIfAbsent(adapter.getVendor(), adapter) != null) {
                throw new IllegalArgumentException("Duplicate adapter for vendor " + adapter.getVendor());
            }
        }
    }

    /**
     * Cisco IOS, Juniper JUNOS and Linux tc.
     */
    public static VendorAdapterRegistry withDefaults() {
        return new VendorAdapterRegistry(List.of(new CiscoIosAdapter(), new JuniperJunosAdapter(), new LinuxTcAdapter()));
    }

    public Optional<VendorAdapter> find(DeviceVendor vendor) {
        return Optional.ofNullable(adapters.get(vendor));
    }

    /**
     * @throws UnsupportedDeviceException if no adapter is registered for the vendor
     */
    public VendorAdapter get(DeviceVendor vendor) {
        return find(vendor).orElseThrow(() ->
                new UnsupportedDeviceException("No command adapter for vendor " + vendor));
    }

    public boolean supports(DeviceVendor vendor) {
        return adapters.containsKey(vendor);
    }
}
