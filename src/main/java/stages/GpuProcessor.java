package stages;

import static org.jocl.CL.*;

import org.jocl.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import image.PixelBuffer;

/**
 * Lookup-table application on the GPU using JOCL (OpenCL 1.x/2.0).
 * Only 8-bit buffers go to the device; anything else, and any OpenCL
 * failure, falls back to {@link Lut#apply}. Output is identical either way.
 */
public final class GpuProcessor {

    private static final Logger logger = LoggerFactory.getLogger(GpuProcessor.class);

    private GpuProcessor() {
    }

    private static final String KERNEL = """
                __kernel void applyLut(
                    __global uchar* samples,
                    __global const uchar* lut,   // 3 x 256 entries: R, G, B
                    const int channels)
                {
                    int i = get_global_id(0) * channels;
                    samples[i]     = lut[samples[i]];
                    samples[i + 1] = lut[256 + samples[i + 1]];
                    samples[i + 2] = lut[512 + samples[i + 2]];
                }
            """;

    public static PixelBuffer applyLut(PixelBuffer src, Lut lut) {
        if (src.bitDepth() != 8)
            return lut.apply(src);
        try {
            return runOnGpu(src, lut);
        } catch (Throwable t) {
            logger.warn("GPU LUT path failed, falling back to CPU: {}", t.getMessage());
            return lut.apply(src);
        }
    }

    // ---------------- JOCL implementation ----------------

    private static PixelBuffer runOnGpu(PixelBuffer src, Lut lut) {
        CL.setExceptionsEnabled(true);

        int n = src.pixelCount();
        int c = src.channels();
        byte[] bytes = new byte[src.sampleCount()];
        for (int i = 0; i < bytes.length; i++)
            bytes[i] = (byte) src.sample(i);
        byte[] table = new byte[3 * 256];
        for (int ch = 0; ch < 3; ch++) {
            for (int v = 0; v < 256; v++)
                table[ch * 256 + v] = (byte) lut.map(ch, v);
        }

        // --- Platform & device ---
        int[] numPlatforms = new int[1];
        clGetPlatformIDs(0, null, numPlatforms);
        if (numPlatforms[0] == 0)
            throw new IllegalStateException("No OpenCL platforms found");

        cl_platform_id[] platforms = new cl_platform_id[numPlatforms[0]];
        clGetPlatformIDs(platforms.length, platforms, null);
        cl_platform_id platform = platforms[0];

        int[] numDevices = new int[1];
        int err = clGetDeviceIDs(platform, CL_DEVICE_TYPE_GPU, 0, null, numDevices);
        if (err != CL_SUCCESS || numDevices[0] == 0)
            throw new IllegalStateException("No OpenCL GPU device found");

        cl_device_id[] devices = new cl_device_id[numDevices[0]];
        clGetDeviceIDs(platform, CL_DEVICE_TYPE_GPU, devices.length, devices, null);
        cl_device_id device = devices[0];

        // --- Context & queue ---
        cl_context_properties props = new cl_context_properties();
        props.addProperty(CL_CONTEXT_PLATFORM, platform);

        cl_context context = clCreateContext(props, 1, new cl_device_id[] { device }, null, null, null);
        cl_command_queue queue = null;
        cl_program program = null;
        cl_kernel kernel = null;
        cl_mem samples = null;
        cl_mem lutMem = null;
        try {
            queue = clCreateCommandQueueWithProperties(context, device, new cl_queue_properties(), null);

            // --- Program & kernel ---
            program = clCreateProgramWithSource(context, 1, new String[] { KERNEL }, null, null);
            clBuildProgram(program, 0, null, null, null, null);
            kernel = clCreateKernel(program, "applyLut", null);

            // --- Device buffers ---
            samples = clCreateBuffer(context, CL_MEM_READ_WRITE | CL_MEM_COPY_HOST_PTR,
                    Sizeof.cl_uchar * bytes.length, Pointer.to(bytes), null);
            lutMem = clCreateBuffer(context, CL_MEM_READ_ONLY | CL_MEM_COPY_HOST_PTR,
                    Sizeof.cl_uchar * table.length, Pointer.to(table), null);

            clSetKernelArg(kernel, 0, Sizeof.cl_mem, Pointer.to(samples));
            clSetKernelArg(kernel, 1, Sizeof.cl_mem, Pointer.to(lutMem));
            clSetKernelArg(kernel, 2, Sizeof.cl_int, Pointer.to(new int[] { c }));

            // --- Launch & read back ---
            clEnqueueNDRangeKernel(queue, kernel, 1, null, new long[] { n }, null, 0, null, null);
            clEnqueueReadBuffer(queue, samples, CL_TRUE, 0,
                    Sizeof.cl_uchar * bytes.length, Pointer.to(bytes), 0, null, null);
        } finally {
            if (lutMem != null)
                clReleaseMemObject(lutMem);
            if (samples != null)
                clReleaseMemObject(samples);
            if (kernel != null)
                clReleaseKernel(kernel);
            if (program != null)
                clReleaseProgram(program);
            if (queue != null)
                clReleaseCommandQueue(queue);
            clReleaseContext(context);
        }

        int[] out = new int[bytes.length];
        for (int i = 0; i < out.length; i++)
            out[i] = bytes[i] & 0xFF;
        logger.debug("GPU LUT applied to {} pixels", n);
        return src.withSamples(out);
    }
}
