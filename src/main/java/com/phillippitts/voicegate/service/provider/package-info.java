/**
 * Provider adapter contract and the registry that turns descriptors into cached adapter instances.
 *
 * <p>Vendor adapters implement {@link com.phillippitts.voicegate.service.provider.SttProvider} or
 * {@link com.phillippitts.voicegate.service.provider.TtsProvider} and are contributed through a
 * {@link com.phillippitts.voicegate.service.provider.ProviderFactory} bean.
 */
package com.phillippitts.voicegate.service.provider;
